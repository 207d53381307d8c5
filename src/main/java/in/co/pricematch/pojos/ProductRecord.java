package in.co.pricematch.pojos;

import java.util.Objects;

/**
 * A product as supplied by the caller (scraper or catalog import).
 * Read-only to the matching engine.
 *
 * <p>{@code id} and a non-blank {@code name} are required; {@code price}, {@code brand} and
 * {@code category} are optional and may be null.</p>
 */
public final class ProductRecord {

    private final long id;
    private final String name;
    private final Double price;
    private final String brand;
    private final String category;

    private ProductRecord(Builder builder) {
        if (builder.id == null) {
            throw new InvalidProductException("Product id is required (name=" + builder.name + ")");
        }
        if (builder.name == null || builder.name.isBlank()) {
            throw new InvalidProductException("Product name is required (id=" + builder.id + ")");
        }
        this.id = builder.id;
        this.name = builder.name;
        this.price = builder.price;
        this.brand = builder.brand;
        this.category = builder.category;
    }

    public static ProductRecord of(long id, String name) {
        return builder().id(id).name(name).build();
    }

    public static ProductRecord of(long id, String name, Double price) {
        return builder().id(id).name(name).price(price).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long id;
        private String name;
        private Double price;
        private String brand;
        private String category;

        public Builder id(Long id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder price(Double price) { this.price = price; return this; }
        public Builder brand(String brand) { this.brand = brand; return this; }
        public Builder category(String category) { this.category = category; return this; }

        public ProductRecord build() { return new ProductRecord(this); }
    }

    public long getId() { return id; }
    public String getName() { return name; }
    public Double getPrice() { return price; }
    public String getBrand() { return brand; }
    public String getCategory() { return category; }

    /**
     * True when a strictly positive price is known.
     */
    public boolean hasPrice() {
        return price != null && price > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductRecord that = (ProductRecord) o;
        return id == that.id && name.equals(that.name)
                && Objects.equals(price, that.price)
                && Objects.equals(brand, that.brand)
                && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, price, brand, category);
    }

    @Override
    public String toString() {
        return "ProductRecord{id=" + id + ", name='" + name + "', price=" + price + "}";
    }
}
