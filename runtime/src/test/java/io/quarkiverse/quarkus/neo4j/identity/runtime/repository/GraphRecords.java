package io.quarkiverse.quarkus.neo4j.identity.runtime.repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.internal.InternalNode;
import org.neo4j.driver.internal.InternalRecord;

/**
 * Builds single-column node records as the stores receive them from a session.
 */
final class GraphRecords {

    static Record node(String alias, long id, List<String> labels, Object... namesAndValues) {
        Map<String, Value> properties = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            properties.put((String) namesAndValues[i], Values.value(namesAndValues[i + 1]));
        }
        Value node = new InternalNode(id, labels, properties).asValue();
        return new InternalRecord(List.of(alias), new Value[] { node });
    }

    private GraphRecords() {
    }
}
