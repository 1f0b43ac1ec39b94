package io.homefinder.storage;

/**
 * One real-estate record.
 * <p>
 * {@code id} equals the record's position in its {@link PropertyStore}.
 * Latitude and longitude are carried for callers that render maps and are
 * never indexed.
 *
 * @param id         position in the store, non-negative
 * @param bedrooms   bedroom count, non-negative
 * @param bathrooms  bathroom count in steps of 0.5, non-negative
 * @param price      price in currency units, positive
 * @param yearBuilt  construction year
 * @param latitude   decimal degrees
 * @param longitude  decimal degrees
 */
public record Property(
        int id,
        int bedrooms,
        double bathrooms,
        long price,
        int yearBuilt,
        double latitude,
        double longitude,
        boolean hasBasement,
        boolean hasFireplace,
        boolean hasAttic,
        boolean hasGarage) {

    public static final int MIN_YEAR_BUILT = 1600;
    public static final int MAX_YEAR_BUILT = 2100;
    /** Largest count whose half-bath units still fit in an int. */
    public static final double MAX_BATHROOMS = Integer.MAX_VALUE / 2;

    public Property {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative: " + id);
        }
        if (bedrooms < 0) {
            throw new IllegalArgumentException("bedrooms must be non-negative: " + bedrooms);
        }
        if (!(bathrooms >= 0d) || bathrooms * 2 != Math.rint(bathrooms * 2)) {
            throw new IllegalArgumentException("bathrooms must be a non-negative multiple of 0.5: " + bathrooms);
        }
        if (bathrooms > MAX_BATHROOMS) {
            throw new IllegalArgumentException("bathrooms must not exceed " + MAX_BATHROOMS + ": " + bathrooms);
        }
        if (price <= 0) {
            throw new IllegalArgumentException("price must be positive: " + price);
        }
        if (yearBuilt < MIN_YEAR_BUILT || yearBuilt > MAX_YEAR_BUILT) {
            throw new IllegalArgumentException("yearBuilt out of range: " + yearBuilt);
        }
    }

    /**
     * Bathroom count in half-bath units, e.g. 2.5 baths is 5.
     */
    public int halfBaths() {
        return Math.toIntExact(Math.round(bathrooms * 2));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; {@code id} is usually left for {@link PropertyStore.Builder} to assign.
     */
    public static final class Builder {
        private int id;
        private int bedrooms;
        private double bathrooms;
        private long price = 1;
        private int yearBuilt = 2000;
        private double latitude;
        private double longitude;
        private boolean hasBasement;
        private boolean hasFireplace;
        private boolean hasAttic;
        private boolean hasGarage;

        private Builder() {
        }

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder bedrooms(int bedrooms) {
            this.bedrooms = bedrooms;
            return this;
        }

        public Builder bathrooms(double bathrooms) {
            this.bathrooms = bathrooms;
            return this;
        }

        public Builder price(long price) {
            this.price = price;
            return this;
        }

        public Builder yearBuilt(int yearBuilt) {
            this.yearBuilt = yearBuilt;
            return this;
        }

        public Builder location(double latitude, double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder basement(boolean hasBasement) {
            this.hasBasement = hasBasement;
            return this;
        }

        public Builder fireplace(boolean hasFireplace) {
            this.hasFireplace = hasFireplace;
            return this;
        }

        public Builder attic(boolean hasAttic) {
            this.hasAttic = hasAttic;
            return this;
        }

        public Builder garage(boolean hasGarage) {
            this.hasGarage = hasGarage;
            return this;
        }

        public Property build() {
            return new Property(id, bedrooms, bathrooms, price, yearBuilt, latitude, longitude,
                    hasBasement, hasFireplace, hasAttic, hasGarage);
        }
    }
}
