package glow.navigator.markup;

/**
 * Leaf value found inside a list control's own embedded document, paired with
 * the list's discriminator ("Global" or "Entity").
 */
public record NestedReference(String listType, String value) {

    public static final String GLOBAL = "Global";

    public boolean isGlobal() {
        return GLOBAL.equalsIgnoreCase(listType);
    }
}
