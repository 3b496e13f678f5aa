package org.broadinstitute.lincer.utils.codecs.gtf;

import org.broadinstitute.lincer.utils.Utils;

/**
 * Feature types of GTF lines, as far as lincer cares about them. Everything but {@link #EXON} and
 * {@link #TRANSCRIPT} is lumped into {@link #OTHER}.
 */
public enum GtfFeatureType {
    EXON("exon"),
    TRANSCRIPT("transcript"),
    OTHER(null);

    private final String featureName;

    GtfFeatureType(final String featureName) {
        this.featureName = featureName;
    }

    /**
     * @return the name in the feature column, or {@code null} for {@link #OTHER}.
     */
    public String getFeatureName() {
        return featureName;
    }

    /**
     * Maps the text of the third GTF column onto a feature type. Matching is case sensitive, as in the GTF format.
     */
    public static GtfFeatureType fromFeatureName(final String name) {
        Utils.nonNull(name, "feature name");
        for (final GtfFeatureType type : values()) {
            if (name.equals(type.featureName)) {
                return type;
            }
        }
        return OTHER;
    }
}
