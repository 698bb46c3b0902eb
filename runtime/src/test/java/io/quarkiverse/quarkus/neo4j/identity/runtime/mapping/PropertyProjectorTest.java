package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.quarkiverse.quarkus.neo4j.identity.runtime.enums.ProjectionMode;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.Fixtures.Employee;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.Fixtures.Person;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.Fixtures.Status;
import io.quarkiverse.quarkus.neo4j.identity.runtime.mapping.Fixtures.T;
import io.quarkiverse.quarkus.neo4j.identity.runtime.query.Patterns;

class PropertyProjectorTest {

    private static Employee employee() {
        Employee employee = new Employee();
        employee.setEntityId(42L);
        employee.setName("Ada");
        employee.setAge(36);
        employee.setActive(true);
        employee.setStatus(Status.ACTIVE);
        employee.setCompany("Analytical Engines");
        employee.setNickname("countess");
        return employee;
    }

    @Test
    void testExcludeReturnsRemainingPropertiesInOrder() {
        Map<String, Object> projection = PropertyProjector.exclude(employee(), "age", "company");

        assertThat(projection.keySet()).containsExactly("name", "active", "status", "external_id");
        assertThat(projection).contains(entry("name", "Ada"), entry("active", true), entry("status", Status.ACTIVE));
    }

    @Test
    void testIncludeReturnsOnlyListedProperties() {
        Map<String, Object> projection = PropertyProjector.include(employee(), "company", "name");

        assertThat(projection).containsExactly(entry("name", "Ada"), entry("company", "Analytical Engines"));
    }

    @Test
    void testNullValuesAreKept() {
        Map<String, Object> projection = PropertyProjector.include(new Person(), "name");

        assertThat(projection).containsEntry("name", null);
    }

    @Test
    void testIdentifierAndUnmappedFieldsAreNeverProjected() {
        Map<String, Object> projection = PropertyProjector.all(employee());

        assertThat(projection).doesNotContainKeys("entityId", "nickname", "cached", "readOnly");
        assertThat(PropertyProjector.include(employee(), "entityId", "nickname")).isEmpty();
    }

    @Test
    void testMatchingIsCaseSensitive() {
        Map<String, Object> projection = PropertyProjector.project(employee(), ProjectionMode.EXCLUDE,
                Set.of("Name", "COMPANY"));

        assertThat(projection).containsKeys("name", "company");
    }

    @Test
    void testProjectionIsUnmodifiable() {
        Map<String, Object> projection = PropertyProjector.all(employee());

        assertThatThrownBy(() -> projection.put("name", "Grace")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testNullInstanceIsRejected() {
        assertThatThrownBy(() -> PropertyProjector.all(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testExcludeIdProjectsRemainingNamesForCreatePattern() {
        T instance = new T();
        instance.setName("a");
        instance.setNormalizedName("A");

        Map<String, Object> projection = PropertyProjector.project(instance, ProjectionMode.EXCLUDE, Set.of("id"));

        assertThat(projection).containsExactly(entry("name", "a"), entry("normalizedName", "A"));
        assertThat(Patterns.node(TypeDescriptors.describe(T.class), "p")).isEqualTo("(p:T)");
    }
}
