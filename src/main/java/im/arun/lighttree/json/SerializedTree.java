package im.arun.lighttree.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.lighttree.model.Node;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Identifier based form of a tree.
 *
 * <p>{@code children_of} maps a map node to an object {@code {child id: key}} and a list node to
 * the array of its children ids, in order. The root maps to null in {@code parent_of}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SerializedTree {

    @JsonProperty("root")
    private String root;

    @JsonProperty("path_separator")
    private String pathSeparator;

    @JsonProperty("nodes")
    private Map<String, Node> nodes;

    @JsonProperty("parent_of")
    private Map<String, String> parentOf;

    @JsonProperty("children_of")
    private Map<String, Object> childrenOf;
}
