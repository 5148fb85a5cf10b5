package im.arun.tocclassifier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.tocclassifier.util.TitleUtils;
import lombok.Builder;
import lombok.Value;

/**
 * A single heading line of a table of contents, as produced by the TOC parser.
 * Entries are immutable; classification stages only ever produce new label maps.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TocEntry {

    /** Position in parsed output, 0-based and contiguous. */
    @JsonProperty("index")
    int index;

    @JsonProperty("title")
    String title;

    @JsonProperty("normalized_title")
    String normalizedTitle;

    @JsonProperty("level")
    int level;

    @JsonProperty("page")
    Integer page;

    /** Roman page token shown next to the page number, e.g. "iv". Never inferred. */
    @JsonProperty("roman")
    String roman;

    /** True only when the line carried an explicit {@code [Front]} marker. */
    @JsonProperty("fm")
    boolean fm;

    @JsonIgnore
    String indentation;

    @JsonIgnore
    String originalLine;

    public boolean hasPage() {
        return page != null;
    }

    /**
     * Convenience factory for entries that do not come from raw TOC text.
     */
    public static TocEntry of(int index, String title, int level, Integer page, String roman, boolean fm) {
        String cleaned = TitleUtils.cleanTitle(title);
        return TocEntry.builder()
            .index(index)
            .title(cleaned)
            .normalizedTitle(TitleUtils.normalizeTitle(cleaned))
            .level(level)
            .page(page)
            .roman(roman)
            .fm(fm)
            .indentation("")
            .originalLine(title)
            .build();
    }

    public static TocEntry of(int index, String title, int level, Integer page) {
        return of(index, title, level, page, null, false);
    }
}
