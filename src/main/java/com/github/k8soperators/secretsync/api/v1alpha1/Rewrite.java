package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;
import java.util.Objects;

/**
 * One rewrite operation. Exactly one of {@code regexp}, {@code merge} or
 * {@code transform} is set.
 */
@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "regexp", "merge", "transform" })
public class Rewrite {

    Regexp regexp;
    Merge merge;
    Transform transform;

    public static Rewrite regexp(String source, String target) {
        Rewrite rewrite = new Rewrite();
        rewrite.setRegexp(new Regexp(source, target));
        return rewrite;
    }

    public static Rewrite merge(Merge merge) {
        Rewrite rewrite = new Rewrite();
        rewrite.setMerge(merge);
        return rewrite;
    }

    public static Rewrite transform(String template) {
        Rewrite rewrite = new Rewrite();
        rewrite.setTransform(new Transform(template));
        return rewrite;
    }

    public Regexp getRegexp() {
        return regexp;
    }

    public void setRegexp(Regexp regexp) {
        this.regexp = regexp;
    }

    public Merge getMerge() {
        return merge;
    }

    public void setMerge(Merge merge) {
        this.merge = merge;
    }

    public Transform getTransform() {
        return transform;
    }

    public void setTransform(Transform transform) {
        this.transform = transform;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Regexp {

        String source;
        String target;

        public Regexp() {
        }

        public Regexp(String source, String target) {
            this.source = source;
            this.target = target;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }
    }

    public enum ConflictPolicy {
        Error,
        Ignore
    }

    public enum MergeStrategy {
        /** Merged object fields become individual keys. */
        Extract,
        /** Merged object is stored as JSON under {@code into}. */
        JSON,
        /** Values are concatenated into one JSON array under {@code into}. */
        Append
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "into", "priority", "conflictPolicy", "strategy" })
    public static class Merge {

        String into;
        List<String> priority;
        ConflictPolicy conflictPolicy;
        MergeStrategy strategy;

        @JsonIgnore
        public ConflictPolicy getConflictPolicyOrDefault() {
            return Objects.requireNonNullElse(conflictPolicy, ConflictPolicy.Error);
        }

        @JsonIgnore
        public MergeStrategy getStrategyOrDefault() {
            return Objects.requireNonNullElse(strategy, MergeStrategy.Extract);
        }

        public String getInto() {
            return into;
        }

        public void setInto(String into) {
            this.into = into;
        }

        public List<String> getPriority() {
            return priority;
        }

        public void setPriority(List<String> priority) {
            this.priority = priority;
        }

        public ConflictPolicy getConflictPolicy() {
            return conflictPolicy;
        }

        public void setConflictPolicy(ConflictPolicy conflictPolicy) {
            this.conflictPolicy = conflictPolicy;
        }

        public MergeStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(MergeStrategy strategy) {
            this.strategy = strategy;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Transform {

        String template;

        public Transform() {
        }

        public Transform(String template) {
            this.template = template;
        }

        public String getTemplate() {
            return template;
        }

        public void setTemplate(String template) {
            this.template = template;
        }
    }
}
