package in.co.pricematch.pojos;

import java.util.Objects;

/**
 * {@code (type, subtype)} category pair assigned to a product name, e.g. {@code spices:turmeric}.
 */
public final class Classification {

    public static final String OTHER_TYPE = "other";
    public static final String GENERIC_SUBTYPE = "generic";

    private static final Classification OTHER = new Classification(OTHER_TYPE, GENERIC_SUBTYPE);

    private final String type;
    private final String subtype;

    public Classification(String type, String subtype) {
        this.type = Objects.requireNonNull(type, "type");
        this.subtype = subtype == null || subtype.isEmpty() ? GENERIC_SUBTYPE : subtype;
    }

    public static Classification other() {
        return OTHER;
    }

    public String getType() { return type; }
    public String getSubtype() { return subtype; }

    /** The {@code type:subtype} token used by rule tables. */
    public String qualifiedName() {
        return type + ":" + subtype;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Classification that = (Classification) o;
        return type.equals(that.type) && subtype.equals(that.subtype);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, subtype);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
