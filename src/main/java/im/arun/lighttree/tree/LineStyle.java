package im.arun.lighttree.tree;

import im.arun.lighttree.exception.InvalidArgumentException;

/**
 * Glyph sets used to draw the tree prefix of each rendered line.
 */
public enum LineStyle {
    ASCII("ascii", "|", "|-- ", "+-- "),
    ASCII_EX("ascii-ex", "│", "├── ", "└── "),
    ASCII_EXR("ascii-exr", "│", "├── ", "╰── "),
    ASCII_EM("ascii-em", "║", "╠══ ", "╚══ "),
    ASCII_EMV("ascii-emv", "║", "╟── ", "╙── "),
    ASCII_EMH("ascii-emh", "│", "╞══ ", "╘══ ");

    private final String label;
    private final String vertical;
    private final String box;
    private final String corner;

    LineStyle(String label, String vertical, String box, String corner) {
        this.label = label;
        this.vertical = vertical;
        this.box = box;
        this.corner = corner;
    }

    public String getLabel() {
        return label;
    }

    public String getVertical() {
        return vertical;
    }

    public String getBox() {
        return box;
    }

    public String getCorner() {
        return corner;
    }

    public static LineStyle of(String label) {
        for (LineStyle style : values()) {
            if (style.label.equals(label)) {
                return style;
            }
        }
        throw new InvalidArgumentException(String.format("Unknown line type '%s'", label));
    }
}
