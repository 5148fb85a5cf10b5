package im.arun.tocclassifier.model;

import lombok.Value;

/**
 * Caller-supplied facts about the document whose TOC is being classified.
 */
@Value
public class DocumentContext {

    private static final DocumentContext EMPTY = new DocumentContext(null);

    /** Total page count of the document, or null when unknown. */
    Integer totalPages;

    public static DocumentContext of(Integer totalPages) {
        return totalPages == null ? EMPTY : new DocumentContext(totalPages);
    }

    public static DocumentContext empty() {
        return EMPTY;
    }

    /**
     * Page-dependent rules only run when a positive page count is known.
     */
    public boolean hasTotalPages() {
        return totalPages != null && totalPages > 0;
    }
}
