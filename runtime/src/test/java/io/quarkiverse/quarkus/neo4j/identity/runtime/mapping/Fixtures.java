package io.quarkiverse.quarkus.neo4j.identity.runtime.mapping;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Entity classes shared by the mapping tests.
 */
public final class Fixtures {

    public enum Status {
        ACTIVE,
        LOCKED
    }

    public static class Person {

        @NodeId
        private Long entityId;

        private String name;
        private int age;
        private boolean active;
        private Status status;

        @Property(name = "external_id")
        private UUID externalId;

        private transient String cached;

        @Transient
        private String nickname;

        private String readOnly;

        public Long getEntityId() {
            return entityId;
        }

        public void setEntityId(Long entityId) {
            this.entityId = entityId;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getAge() {
            return age;
        }

        public void setAge(int age) {
            this.age = age;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public Status getStatus() {
            return status;
        }

        public void setStatus(Status status) {
            this.status = status;
        }

        public UUID getExternalId() {
            return externalId;
        }

        public void setExternalId(UUID externalId) {
            this.externalId = externalId;
        }

        public String getCached() {
            return cached;
        }

        public void setCached(String cached) {
            this.cached = cached;
        }

        public String getNickname() {
            return nickname;
        }

        public void setNickname(String nickname) {
            this.nickname = nickname;
        }

        public String getReadOnly() {
            return readOnly;
        }
    }

    public static class Employee extends Person {

        private String company;

        public String getCompany() {
            return company;
        }

        public void setCompany(String company) {
            this.company = company;
        }
    }

    @NodeEntity(label = "Boss")
    public static class Manager extends Employee {
    }

    @RelationshipEntity(type = "WORKS_FOR")
    public static class WorksFor {
    }

    public static class NoDefaultConstructor {

        private String name;

        public NoDefaultConstructor(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    public static class Inventory {

        private String name;
        private Set<String> tags;
        private short level;
        private ZonedDateTime at;
        private BigDecimal amount;
        private HashSet<String> codes;
        private SortedSet<String> ranks;
        private LinkedList<Long> history;
        private TreeMap<String, Object> attributes;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Set<String> getTags() {
            return tags;
        }

        public void setTags(Set<String> tags) {
            this.tags = tags;
        }

        public short getLevel() {
            return level;
        }

        public void setLevel(short level) {
            this.level = level;
        }

        public ZonedDateTime getAt() {
            return at;
        }

        public void setAt(ZonedDateTime at) {
            this.at = at;
        }

        public BigDecimal getAmount() {
            return amount;
        }

        public void setAmount(BigDecimal amount) {
            this.amount = amount;
        }

        public HashSet<String> getCodes() {
            return codes;
        }

        public void setCodes(HashSet<String> codes) {
            this.codes = codes;
        }

        public SortedSet<String> getRanks() {
            return ranks;
        }

        public void setRanks(SortedSet<String> ranks) {
            this.ranks = ranks;
        }

        public LinkedList<Long> getHistory() {
            return history;
        }

        public void setHistory(LinkedList<Long> history) {
            this.history = history;
        }

        public TreeMap<String, Object> getAttributes() {
            return attributes;
        }

        public void setAttributes(TreeMap<String, Object> attributes) {
            this.attributes = attributes;
        }
    }

    public static class T {

        private String id;
        private String name;
        private String normalizedName;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getNormalizedName() {
            return normalizedName;
        }

        public void setNormalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
        }
    }

    private Fixtures() {
    }
}
