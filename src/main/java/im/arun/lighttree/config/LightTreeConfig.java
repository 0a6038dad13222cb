package im.arun.lighttree.config;

import im.arun.lighttree.tree.LineStyle;
import im.arun.lighttree.tree.ShowOptions;
import lombok.Data;

@Data
public class LightTreeConfig {
    private String pathSeparator = ".";
    private String lineType = "ascii-ex";
    private int lineMaxLength = 60;
    private String keyDelimiter = ": ";
    private boolean displayKey = true;
    private Integer limit;

    /**
     * Rendering options carrying these defaults.
     */
    public ShowOptions.ShowOptionsBuilder showOptions() {
        return ShowOptions.builder()
            .lineStyle(LineStyle.of(lineType))
            .lineMaxLength(lineMaxLength)
            .keyDelimiter(keyDelimiter)
            .displayKey(displayKey)
            .limit(limit);
    }
}
