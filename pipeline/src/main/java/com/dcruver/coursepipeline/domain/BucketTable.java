package com.dcruver.coursepipeline.domain;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of (lower bound, label) pairs. A value falls into the bucket with the
 * greatest lower bound not above it; values below every bound fall into the first bucket.
 *
 * Shared by dimension scoring, tier mapping and token usage classification.
 */
public final class BucketTable<T> {

    private final List<Bucket<T>> buckets;

    private BucketTable(List<Bucket<T>> buckets) {
        this.buckets = List.copyOf(buckets);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Scoring table for a 0-2 dimension: 1 from {@code oneAt}, 2 from {@code twoAt}.
     */
    public static BucketTable<Integer> scoring(double oneAt, double twoAt) {
        return BucketTable.<Integer>builder()
            .bucket(Double.NEGATIVE_INFINITY, 0)
            .bucket(oneAt, 1)
            .bucket(twoAt, 2)
            .build();
    }

    public T classify(double value) {
        for (int i = buckets.size() - 1; i > 0; i--) {
            Bucket<T> bucket = buckets.get(i);
            if (value >= bucket.getLowerBound()) {
                return bucket.getLabel();
            }
        }
        return buckets.get(0).getLabel();
    }

    public List<Bucket<T>> getBuckets() {
        return buckets;
    }

    @Value
    public static class Bucket<T> {
        double lowerBound;
        T label;
    }

    public static final class Builder<T> {
        private final List<Bucket<T>> buckets = new ArrayList<>();

        private Builder() {
        }

        /**
         * Add the next bucket. Lower bounds must be strictly ascending.
         */
        public Builder<T> bucket(double lowerBound, T label) {
            if (label == null) {
                throw new IllegalArgumentException("Bucket label must not be null");
            }
            if (!buckets.isEmpty()) {
                double previous = buckets.get(buckets.size() - 1).getLowerBound();
                if (lowerBound <= previous) {
                    throw new IllegalArgumentException(String.format(
                        "Bucket lower bounds must ascend: %s follows %s", lowerBound, previous));
                }
            }
            buckets.add(new Bucket<>(lowerBound, label));
            return this;
        }

        public BucketTable<T> build() {
            if (buckets.isEmpty()) {
                throw new IllegalArgumentException("Bucket table needs at least one bucket");
            }
            return new BucketTable<>(buckets);
        }
    }
}
