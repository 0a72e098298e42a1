package co.fanki.threatscore.shared;

import java.io.Serializable;

/**
 * Marker interface for immutable, self-validating values compared by their
 * attributes, such as a threat score.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
