package glow.navigator.model;

/**
 * Attribute names shared by node and edge attribute bags.
 */
public final class Attr {

    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String ENTITY = "entity";
    public static final String LINK_TYPE = "link_type";
    public static final String COUNTS = "counts";

    public static final String LINK = "link";

    private Attr() {
    }
}
