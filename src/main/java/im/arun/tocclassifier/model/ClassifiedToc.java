package im.arun.tocclassifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON view of a classified table of contents for one document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassifiedToc {

    @JsonProperty("doc_name")
    private String docName;

    @JsonProperty("page_count")
    private Integer pageCount;

    @JsonProperty("entries")
    private List<ClassifiedEntry> entries;

    @JsonProperty("trace")
    private List<RuleTrace.Change> trace;
}
