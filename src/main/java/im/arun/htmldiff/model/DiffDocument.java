package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The complete result of comparing two HTML documents, as written by the CLI.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffDocument {

    @JsonProperty("original_name")
    private String originalName;

    @JsonProperty("modified_name")
    private String modifiedName;

    @JsonProperty("summary")
    private DiffSummary summary;

    @JsonProperty("tree")
    private RootNode tree;

    @JsonProperty("resolved")
    private String resolved;
}
