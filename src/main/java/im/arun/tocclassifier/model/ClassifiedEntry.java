package im.arun.tocclassifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One TOC entry together with its final section type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassifiedEntry {

    @JsonProperty("index")
    private Integer index;

    @JsonProperty("level")
    private Integer level;

    @JsonProperty("title")
    private String title;

    @JsonProperty("page")
    private Integer page;

    @JsonProperty("roman")
    private String roman;

    @JsonProperty("front_matter_marker")
    private Boolean frontMatterMarker;

    @JsonProperty("section_type")
    private SectionType sectionType;

    public static ClassifiedEntry from(TocEntry entry, SectionType sectionType) {
        return new ClassifiedEntry(
            entry.getIndex(),
            entry.getLevel(),
            entry.getTitle(),
            entry.getPage(),
            entry.getRoman(),
            entry.isFm() ? Boolean.TRUE : null,
            sectionType
        );
    }
}
