package im.arun.tocclassifier.model;

import lombok.Value;

/**
 * A classification read back from a stored classified TOC, with the sequence rules re-applied.
 */
@Value
public class RestoredClassification {

    TocClassification classification;

    /**
     * True when the stored text is stale: the sequence rules changed a label, or the raw TOC
     * carries roman page tokens or front-matter markers that the stored text lacks.
     */
    boolean needsResave;
}
