package com.automation.core.matching;

import com.automation.core.model.RelatedResource;
import com.automation.core.model.Resource;
import com.automation.core.model.ResourceSpecification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceMatcherTest {

    private final Resource flowRun = Resource.of(Map.of(
        Resource.ID, "prefect.flow-run.123",
        Resource.NAME, "nightly-etl"
    ));

    @Test
    void matches_emptySpecification_shouldMatchAnything() {
        assertThat(ResourceMatcher.matches(ResourceSpecification.ANY, flowRun)).isTrue();
        assertThat(ResourceMatcher.matches(ResourceSpecification.ANY, Resource.of(Map.of()))).isTrue();
    }

    @Test
    void matches_shouldSupportExactWildcardAndPrefix() {
        assertThat(ResourceMatcher.matches(spec(Resource.ID, "prefect.flow-run.123"), flowRun)).isTrue();
        assertThat(ResourceMatcher.matches(spec(Resource.ID, "prefect.flow-run.*"), flowRun)).isTrue();
        assertThat(ResourceMatcher.matches(spec(Resource.NAME, "*"), flowRun)).isTrue();

        assertThat(ResourceMatcher.matches(spec(Resource.ID, "prefect.deployment.*"), flowRun)).isFalse();
        assertThat(ResourceMatcher.matches(spec("missing", "*"), flowRun)).isFalse();
    }

    @Test
    void matches_negation_shouldAcceptAbsentOrDifferentValues() {
        assertThat(ResourceMatcher.matches(spec(Resource.NAME, "!other"), flowRun)).isTrue();
        assertThat(ResourceMatcher.matches(spec("missing", "!anything"), flowRun)).isTrue();
        assertThat(ResourceMatcher.matches(spec(Resource.NAME, "!nightly-etl"), flowRun)).isFalse();
        assertThat(ResourceMatcher.matches(spec(Resource.NAME, "!nightly*"), flowRun)).isFalse();
    }

    @Test
    void matches_listOfPatterns_shouldMatchAnyOf() {
        ResourceSpecification spec = new ResourceSpecification(Map.of(
            Resource.NAME, List.of("weekly-report", "nightly-*")
        ));

        assertThat(ResourceMatcher.matches(spec, flowRun)).isTrue();
    }

    @Test
    void matches_allLabelsMustMatch() {
        ResourceSpecification spec = ResourceSpecification.of(Map.of(
            Resource.ID, "prefect.flow-run.*",
            Resource.NAME, "weekly-report"
        ));

        assertThat(ResourceMatcher.matches(spec, flowRun)).isFalse();
    }

    @Test
    @DisplayName("match_related with role and id only matches events carrying such a related resource")
    void matchesRelated_shouldRequireOneResourceSatisfyingAllLabels() {
        ResourceSpecification spec = ResourceSpecification.of(Map.of(
            Resource.ROLE, "deployment",
            Resource.ID, "prefect.deployment.X"
        ));

        assertThat(ResourceMatcher.matchesRelated(spec, List.of(
            RelatedResource.of("prefect.flow.1", "flow"),
            RelatedResource.of("prefect.deployment.X", "deployment")
        ))).isTrue();

        assertThat(ResourceMatcher.matchesRelated(spec, List.of(
            RelatedResource.of("prefect.deployment.X", "work-queue"),
            RelatedResource.of("prefect.deployment.Y", "deployment")
        ))).isFalse();

        assertThat(ResourceMatcher.matchesRelated(spec, List.of())).isFalse();
    }

    @Test
    void matchesRelated_emptySpecification_shouldPass() {
        assertThat(ResourceMatcher.matchesRelated(ResourceSpecification.ANY, List.of())).isTrue();
    }

    @Test
    void matchesEvent_shouldHandleEmptyExactAndPrefixPatterns() {
        assertThat(ResourceMatcher.matchesEvent(Set.of(), "prefect.flow-run.Running")).isTrue();
        assertThat(ResourceMatcher.matchesEvent(Set.of("prefect.flow-run.Running"), "prefect.flow-run.Running")).isTrue();
        assertThat(ResourceMatcher.matchesEvent(Set.of("prefect.flow-run.*"), "prefect.flow-run.Failed")).isTrue();
        assertThat(ResourceMatcher.matchesEvent(Set.of("prefect.flow-run.Completed"), "prefect.flow-run.Failed")).isFalse();

        assertThat(ResourceMatcher.matchesAnyEvent(Set.of(), "prefect.flow-run.Running")).isFalse();
    }

    @Test
    void matching_shouldNeverThrowOnMalformedInput() {
        assertThat(ResourceMatcher.matches(spec(Resource.ID, "pre*fix"), flowRun)).isFalse();
        assertThat(ResourceMatcher.matches(spec(Resource.ID, "!"), flowRun)).isFalse();
        assertThat(ResourceMatcher.matches(spec(Resource.ID, ""), flowRun)).isFalse();
        assertThat(ResourceMatcher.matches(spec(Resource.ID, "*"), null)).isFalse();
        assertThat(ResourceMatcher.matchesEvent(Set.of("a.*"), null)).isFalse();
    }

    @Test
    void validate_shouldReportMalformedPatterns() {
        ResourceSpecification spec = new ResourceSpecification(Map.of(
            Resource.ID, List.of("pre*fix"),
            Resource.NAME, List.of("!"),
            "empty", List.of()
        ));

        List<String> problems = ResourceMatcher.validate("match", spec);

        assertThat(problems).hasSize(3);
        assertThat(problems).anySatisfy(p -> assertThat(p).contains("pre*fix"));
        assertThat(ResourceMatcher.validate("match", spec(Resource.ID, "prefect.flow-run.*"))).isEmpty();
    }

    @Test
    void validateEventPatterns_shouldRejectInnerWildcards() {
        assertThat(ResourceMatcher.validateEventPatterns("expect", Set.of("prefect.*.Failed"))).hasSize(1);
        assertThat(ResourceMatcher.validateEventPatterns("expect", Set.of("prefect.flow-run.*", "*"))).isEmpty();
    }

    private static ResourceSpecification spec(String label, String pattern) {
        return ResourceSpecification.of(Map.of(label, pattern));
    }
}
