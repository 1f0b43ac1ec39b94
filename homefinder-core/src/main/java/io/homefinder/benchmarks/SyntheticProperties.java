package io.homefinder.benchmarks;

import io.homefinder.storage.Property;
import io.homefinder.storage.PropertyStore;

import java.util.SplittableRandom;

/**
 * Reproducible synthetic dataset with value distributions loosely shaped like
 * a city's residential sales: 1-6 bedrooms, 1-4 baths in half steps, prices
 * between 60k and 1.5M, construction years 1880-2018.
 */
public final class SyntheticProperties {

    private SyntheticProperties() {
    }

    public static PropertyStore generate(int count, long seed) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        var random = new SplittableRandom(seed);
        var builder = PropertyStore.builder();
        for (var i = 0; i < count; i++) {
            var bedrooms = 1 + random.nextInt(6);
            var bathrooms = Math.min(4d, 1d + random.nextInt(Math.max(1, bedrooms)) * 0.5d);
            var price = 60_000L + (long) (Math.pow(random.nextDouble(), 2) * 1_440_000d);
            builder.add(Property.builder()
                    .bedrooms(bedrooms)
                    .bathrooms(bathrooms)
                    .price(price)
                    .yearBuilt(1880 + random.nextInt(139))
                    .location(41.64 + random.nextDouble() * 0.38, -87.94 + random.nextDouble() * 0.42)
                    .basement(random.nextInt(10) < 6)
                    .fireplace(random.nextInt(10) < 2)
                    .attic(random.nextInt(10) < 3)
                    .garage(random.nextInt(10) < 7));
        }
        return builder.build();
    }
}
