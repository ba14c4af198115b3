package com.automation.core.action;

import com.automation.core.model.RelatedResource;

import java.util.List;

/**
 * What a successful act() produced.
 *
 * @param statusCode HTTP-style status reported by the target system
 * @param related resources the action touched, carried on the executed event
 */
public record ActionResult(int statusCode, List<RelatedResource> related) {

    public static final int OK = 200;
    public static final int CREATED = 201;

    public ActionResult {
        related = related == null ? List.of() : List.copyOf(related);
    }

    public static ActionResult of(int statusCode, RelatedResource... related) {
        return new ActionResult(statusCode, List.of(related));
    }
}
