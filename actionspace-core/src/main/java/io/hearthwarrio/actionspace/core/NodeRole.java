package io.hearthwarrio.actionspace.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of accessibility roles the pipeline knows how to classify.
 * <p>
 * Each constant declares its category and (for addressable roles) its one-letter ID prefix.
 * Roles reported by the browser that are not listed here are carried as {@link Role#other(String)}.
 */
public enum NodeRole {
    // interaction
    BUTTON("button", NodeCategory.INTERACTION, "B"),
    LINK("link", NodeCategory.INTERACTION, "L"),
    COMBOBOX("combobox", NodeCategory.INTERACTION, "I"),
    LISTBOX("listbox", NodeCategory.INTERACTION, "I"),
    TEXTBOX("textbox", NodeCategory.INTERACTION, "I"),
    CHECKBOX("checkbox", NodeCategory.INTERACTION, "B"),
    SEARCHBOX("searchbox", NodeCategory.INTERACTION, "I"),
    RADIO("radio", NodeCategory.INTERACTION, "B"),
    TAB("tab", NodeCategory.INTERACTION, "B"),
    MENUITEM("menuitem", NodeCategory.INTERACTION, "B"),
    SLIDER("slider", NodeCategory.INTERACTION, "I"),
    SWITCH("switch", NodeCategory.INTERACTION, "B"),
    MENUITEMCHECKBOX("menuitemcheckbox", NodeCategory.INTERACTION, "B"),
    MENUITEMRADIO("menuitemradio", NodeCategory.INTERACTION, "B"),

    // text
    TEXT("text", NodeCategory.TEXT, null),
    HEADING("heading", NodeCategory.TEXT, null),
    PARAGRAPH("paragraph", NodeCategory.TEXT, null),
    BLOCKQUOTE("blockquote", NodeCategory.TEXT, null),
    CAPTION("caption", NodeCategory.TEXT, null),
    CONTENTINFO("contentinfo", NodeCategory.TEXT, null),
    DEFINITION("definition", NodeCategory.TEXT, null),
    EMPHASIS("emphasis", NodeCategory.TEXT, null),
    LOG("log", NodeCategory.TEXT, null),
    NOTE("note", NodeCategory.TEXT, null),
    STATUS("status", NodeCategory.TEXT, null),
    STRONG("strong", NodeCategory.TEXT, null),
    SUBSCRIPT("subscript", NodeCategory.TEXT, null),
    SUPERSCRIPT("superscript", NodeCategory.TEXT, null),
    TERM("term", NodeCategory.TEXT, null),
    TIME("time", NodeCategory.TEXT, null),
    LINE_BREAK("LineBreak", NodeCategory.TEXT, null),
    DESCRIPTION_LIST("DescriptionList", NodeCategory.TEXT, null),

    // list
    LIST("list", NodeCategory.LIST, null),
    LISTITEM("listitem", NodeCategory.LIST, null),
    LIST_MARKER("ListMarker", NodeCategory.LIST, null),

    // table
    TABLE("table", NodeCategory.TABLE, null),
    ROW("row", NodeCategory.TABLE, null),
    COLUMN("column", NodeCategory.TABLE, null),
    CELL("cell", NodeCategory.TABLE, null),
    COLUMNHEADER("columnheader", NodeCategory.TABLE, null),
    GRID("grid", NodeCategory.TABLE, null),
    GRIDCELL("gridcell", NodeCategory.TABLE, null),
    ROWGROUP("rowgroup", NodeCategory.TABLE, null),
    ROWHEADER("rowheader", NodeCategory.TABLE, null),

    // other
    COMPLEMENTARY("complementary", NodeCategory.OTHER, null),
    DELETION("deletion", NodeCategory.OTHER, null),
    INSERTION("insertion", NodeCategory.OTHER, null),
    MARQUEE("marquee", NodeCategory.OTHER, null),
    METER("meter", NodeCategory.OTHER, null),
    PRESENTATION("presentation", NodeCategory.OTHER, null),
    PROGRESSBAR("progressbar", NodeCategory.OTHER, null),
    SCROLLBAR("scrollbar", NodeCategory.OTHER, null),
    SEPARATOR("separator", NodeCategory.OTHER, null),
    SPINBUTTON("spinbutton", NodeCategory.OTHER, null),
    TIMER("timer", NodeCategory.OTHER, null),
    IFRAME("Iframe", NodeCategory.OTHER, null),

    // image
    IMAGE("image", NodeCategory.IMAGE, "F"),
    IMG("img", NodeCategory.IMAGE, "F"),
    FIGURE("figure", NodeCategory.IMAGE, null),

    // structural
    GROUP("group", NodeCategory.STRUCTURAL, null),
    GENERIC("generic", NodeCategory.STRUCTURAL, null),
    NONE("none", NodeCategory.STRUCTURAL, null),
    APPLICATION("application", NodeCategory.STRUCTURAL, null),
    MAIN("main", NodeCategory.STRUCTURAL, null),
    WEB_AREA("WebArea", NodeCategory.STRUCTURAL, null),

    // data display
    ALERT("alert", NodeCategory.DATA_DISPLAY, null),
    ALERTDIALOG("alertdialog", NodeCategory.DATA_DISPLAY, null),
    ARTICLE("article", NodeCategory.DATA_DISPLAY, null),
    BANNER("banner", NodeCategory.DATA_DISPLAY, null),
    DIRECTORY("directory", NodeCategory.DATA_DISPLAY, null),
    DOCUMENT("document", NodeCategory.DATA_DISPLAY, null),
    DIALOG("dialog", NodeCategory.DATA_DISPLAY, null),
    FEED("feed", NodeCategory.DATA_DISPLAY, null),
    NAVIGATION("navigation", NodeCategory.DATA_DISPLAY, null),
    MENUBAR("menubar", NodeCategory.DATA_DISPLAY, null),
    RADIOGROUP("radiogroup", NodeCategory.DATA_DISPLAY, null),
    REGION("region", NodeCategory.DATA_DISPLAY, null),
    SEARCH("search", NodeCategory.DATA_DISPLAY, null),
    TABLIST("tablist", NodeCategory.DATA_DISPLAY, null),
    TABPANEL("tabpanel", NodeCategory.DATA_DISPLAY, null),
    TOOLBAR("toolbar", NodeCategory.DATA_DISPLAY, null),
    TOOLTIP("tooltip", NodeCategory.DATA_DISPLAY, null),
    FORM("form", NodeCategory.DATA_DISPLAY, null),
    MENU("menu", NodeCategory.DATA_DISPLAY, null),
    MENU_LIST_POPUP("MenuListPopup", NodeCategory.DATA_DISPLAY, null),

    // code
    CODE("code", NodeCategory.CODE, null),
    MATH("math", NodeCategory.CODE, null),

    // tree
    TREE("tree", NodeCategory.TREE, null),
    TREEGRID("treegrid", NodeCategory.TREE, null),
    TREEITEM("treeitem", NodeCategory.TREE, null),

    // parameters
    OPTION("option", NodeCategory.PARAMETERS, "O");

    /**
     * Roles that only exist to hold other nodes. They lose every role promotion.
     */
    public static final Set<NodeRole> PLACEHOLDERS = Collections.unmodifiableSet(EnumSet.of(GROUP, GENERIC, NONE));

    private static final Map<String, NodeRole> BY_LOWER_VALUE = new HashMap<>();

    static {
        for (NodeRole role : values()) {
            BY_LOWER_VALUE.put(role.value.toLowerCase(Locale.ROOT), role);
        }
    }

    private final String value;
    private final NodeCategory category;
    private final String idPrefix;

    NodeRole(String value, NodeCategory category, String idPrefix) {
        this.value = value;
        this.category = category;
        this.idPrefix = idPrefix;
    }

    public String getValue() {
        return value;
    }

    public NodeCategory getCategory() {
        return category;
    }

    /**
     * One-letter prefix used when an ID is stamped on a node with this role.
     *
     * @return prefix, or empty when nodes with this role are never addressed
     */
    public Optional<String> getIdPrefix() {
        return Optional.ofNullable(idPrefix);
    }

    public boolean isPlaceholder() {
        return PLACEHOLDERS.contains(this);
    }

    /**
     * Case-insensitive lookup of a browser role value.
     *
     * @param value raw role value (may be null)
     * @return the recognised role, or empty
     */
    public static Optional<NodeRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_LOWER_VALUE.get(value.trim().toLowerCase(Locale.ROOT)));
    }
}
