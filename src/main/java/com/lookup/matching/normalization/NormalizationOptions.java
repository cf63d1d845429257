package com.lookup.matching.normalization;

import java.util.Objects;

/**
 * Toggles for the steps of {@link StringNormalizer}.
 * Each step is independent; the defaults trim, lowercase, strip accents and collapse whitespace.
 */
public final class NormalizationOptions {

    private static final NormalizationOptions DEFAULTS = builder().build();

    private final boolean trim;
    private final boolean lowercase;
    private final boolean removeAccents;
    private final boolean removeNonAlphanumeric;
    private final boolean collapseWhitespace;

    private NormalizationOptions(Builder builder) {
        this.trim = builder.trim;
        this.lowercase = builder.lowercase;
        this.removeAccents = builder.removeAccents;
        this.removeNonAlphanumeric = builder.removeNonAlphanumeric;
        this.collapseWhitespace = builder.collapseWhitespace;
    }

    public boolean isTrim() {
        return trim;
    }

    public boolean isLowercase() {
        return lowercase;
    }

    public boolean isRemoveAccents() {
        return removeAccents;
    }

    public boolean isRemoveNonAlphanumeric() {
        return removeNonAlphanumeric;
    }

    public boolean isCollapseWhitespace() {
        return collapseWhitespace;
    }

    public static NormalizationOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Options that keep case but still fold accents and whitespace.
     */
    public static NormalizationOptions caseSensitive() {
        return builder().lowercase(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationOptions that = (NormalizationOptions) o;
        return trim == that.trim
                && lowercase == that.lowercase
                && removeAccents == that.removeAccents
                && removeNonAlphanumeric == that.removeNonAlphanumeric
                && collapseWhitespace == that.collapseWhitespace;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trim, lowercase, removeAccents, removeNonAlphanumeric, collapseWhitespace);
    }

    @Override
    public String toString() {
        return "NormalizationOptions{" +
                "trim=" + trim +
                ", lowercase=" + lowercase +
                ", removeAccents=" + removeAccents +
                ", removeNonAlphanumeric=" + removeNonAlphanumeric +
                ", collapseWhitespace=" + collapseWhitespace +
                '}';
    }

    public static class Builder {
        private boolean trim = true;
        private boolean lowercase = true;
        private boolean removeAccents = true;
        private boolean removeNonAlphanumeric = false;
        private boolean collapseWhitespace = true;

        public Builder trim(boolean trim) {
            this.trim = trim;
            return this;
        }

        public Builder lowercase(boolean lowercase) {
            this.lowercase = lowercase;
            return this;
        }

        public Builder removeAccents(boolean removeAccents) {
            this.removeAccents = removeAccents;
            return this;
        }

        public Builder removeNonAlphanumeric(boolean removeNonAlphanumeric) {
            this.removeNonAlphanumeric = removeNonAlphanumeric;
            return this;
        }

        public Builder collapseWhitespace(boolean collapseWhitespace) {
            this.collapseWhitespace = collapseWhitespace;
            return this;
        }

        public NormalizationOptions build() {
            return new NormalizationOptions(this);
        }
    }
}
