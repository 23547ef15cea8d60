package work.lcod.survey.model;

import java.util.Locale;

/**
 * Structural role of a node. Raw document types map onto these three roles.
 */
public enum NodeType {
    SECTION,
    PAGE,
    BLOCK;

    /** {@code section} and {@code set}/{@code page} are containers; every other type is a block. */
    public static NodeType fromTypeName(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return BLOCK;
        }
        return switch (typeName.trim().toLowerCase(Locale.ROOT)) {
            case "section" -> SECTION;
            case "set", "page" -> PAGE;
            default -> BLOCK;
        };
    }

    public String defaultTypeName() {
        return switch (this) {
            case SECTION -> "section";
            case PAGE -> "set";
            case BLOCK -> "textfield";
        };
    }
}
