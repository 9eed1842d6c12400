package im.arun.htmldiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Number of reviewable nodes per status in a diffed tree.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiffSummary {

    @JsonProperty("unchanged")
    private int unchanged;

    @JsonProperty("added")
    private int added;

    @JsonProperty("removed")
    private int removed;

    @JsonProperty("changed")
    private int changed;

    public void increment(NodeStatus status) {
        switch (status) {
            case UNCHANGED:
                unchanged++;
                break;
            case ADDED:
                added++;
                break;
            case REMOVED:
                removed++;
                break;
            case CHANGED:
                changed++;
                break;
            default:
                throw new IllegalStateException("Unexpected status: " + status);
        }
    }

    @JsonIgnore
    public int getTotal() {
        return unchanged + added + removed + changed;
    }

    @JsonIgnore
    public boolean hasChanges() {
        return added + removed + changed > 0;
    }
}
