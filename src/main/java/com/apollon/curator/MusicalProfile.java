package com.apollon.curator;

import java.util.List;

/**
 * The musical attributes compared by {@link CompatibilityEvaluator}.
 * <p>
 * Implemented by real library tracks ({@link Track}) and by the aggregate {@link CentroidProfile}, so that a
 * candidate can be checked against either one without inventing an identity for the aggregate.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public interface MusicalProfile {

    /**
     * @return tempo in beats per minute; zero or negative means the tempo is unknown
     */
    double bpm();

    /**
     * @return Camelot wheel label such as "8A", or "Unknown"
     */
    String camelotPosition();

    /**
     * @return time signature label such as "4/4", or "Unknown"
     */
    String timeSignature();

    /**
     * @return genre tags in their original order and casing; never null
     */
    List<String> genres();
}
