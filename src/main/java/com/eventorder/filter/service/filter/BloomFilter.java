package com.eventorder.filter.service.filter;

import java.util.BitSet;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Bloom filter sized from a capacity and a target false-positive rate.
 *
 * Uses Dillinger and Manolios double hashing: the element's own hashCode is the
 * primary hash and a second, independent hash function supplies the stride.
 * Built-in secondary hashes exist for String, Integer and Long elements; any
 * other element type needs an explicit hash function.
 *
 * Adding more than the design capacity is allowed but silently raises the
 * false-positive rate. Not thread-safe.
 *
 * @param <T> the element type
 */
public class BloomFilter<T> implements MembershipFilter<T> {

    private static final double LN2 = Math.log(2.0);

    private final BitSet hashBits;
    private final int bitCount;
    private final int hashFunctionCount;
    private final ToIntFunction<? super T> secondaryHash;

    BloomFilter(int capacity, double errorRate, ToIntFunction<? super T> secondaryHash, int m, int k) {
        if (m < 1) {
            throw new FilterConstructionException(String.format(
                    "The provided capacity and errorRate values would result in a bit array longer than %d. "
                            + "Please reduce either of these values. Capacity: %d, Error rate: %s",
                    Integer.MAX_VALUE, capacity, errorRate),
                    FilterConstructionException.CAPACITY_OVERFLOW);
        }
        this.secondaryHash = secondaryHash;
        this.bitCount = m;
        this.hashFunctionCount = k;
        this.hashBits = new BitSet(m);
    }

    // ==================== Factories ====================

    /**
     * Creates a filter with an error rate of 1/capacity and a built-in hash.
     *
     * @throws FilterConstructionException if no built-in hash exists for the type
     */
    public static <T> BloomFilter<T> create(Class<T> type, int capacity) {
        return create(type, capacity, bestErrorRate(capacity), null);
    }

    /**
     * Creates a filter with a built-in hash.
     *
     * @throws FilterConstructionException if no built-in hash exists for the type
     */
    public static <T> BloomFilter<T> create(Class<T> type, int capacity, double errorRate) {
        return create(type, capacity, errorRate, null);
    }

    /**
     * Creates a filter with an error rate of 1/capacity.
     *
     * @param hashFunction secondary hash; when null a built-in one is looked up
     */
    public static <T> BloomFilter<T> create(Class<T> type, int capacity,
                                            ToIntFunction<? super T> hashFunction) {
        return create(type, capacity, bestErrorRate(capacity), hashFunction);
    }

    /**
     * Creates a filter using the optimal bit array length and hash count for the
     * given capacity and error rate.
     *
     * @param type the element type, used to pick a built-in hash
     * @param capacity anticipated number of items
     * @param errorRate acceptable false-positive rate, e.g. 0.01 for 1%
     * @param hashFunction secondary hash; when null a built-in one is looked up
     * @throws IllegalArgumentException if capacity or errorRate is out of range
     * @throws FilterConstructionException if the bit array would overflow or no hash is available
     */
    public static <T> BloomFilter<T> create(Class<T> type, int capacity, double errorRate,
                                            ToIntFunction<? super T> hashFunction) {
        Objects.requireNonNull(type, "type");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        if (!(errorRate > 0.0 && errorRate < 1.0)) {
            throw new IllegalArgumentException("errorRate must be in (0, 1), was " + errorRate);
        }

        ToIntFunction<? super T> secondary = hashFunction != null ? hashFunction : builtInHash(type);
        int m = bestM(capacity, errorRate);
        int k = m < 1 ? 0 : bestK(capacity, m);
        return new BloomFilter<>(capacity, errorRate, secondary, m, k);
    }

    // ==================== Filter Operations ====================

    @Override
    public void add(T item) {
        int primary = item.hashCode();
        int secondary = secondaryHash.applyAsInt(item);

        for (int i = 0; i < hashFunctionCount; i++) {
            hashBits.set(computeHash(primary, secondary, i));
        }
    }

    @Override
    public boolean contains(T item) {
        int primary = item.hashCode();
        int secondary = secondaryHash.applyAsInt(item);

        for (int i = 0; i < hashFunctionCount; i++) {
            if (!hashBits.get(computeHash(primary, secondary, i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public double truthiness() {
        return hashBits.cardinality() / (double) bitCount;
    }

    public int getBitCount() {
        return bitCount;
    }

    public int getHashFunctionCount() {
        return hashFunctionCount;
    }

    // ==================== Sizing ====================

    /**
     * Double hashing probe; arithmetic wraps at 32 bits.
     */
    private int computeHash(int primaryHash, int secondaryHash, int i) {
        int resultingHash = (primaryHash + (i * secondaryHash)) % bitCount;
        return Math.abs(resultingHash);
    }

    static int bestM(int capacity, double errorRate) {
        double m = Math.ceil(capacity * (Math.log(errorRate) / Math.log(1.0 / Math.pow(2.0, LN2))));
        if (m > Integer.MAX_VALUE) {
            return -1;
        }
        return (int) m;
    }

    static int bestK(int capacity, int m) {
        return Math.max(1, (int) Math.round(LN2 * m / capacity));
    }

    static double bestErrorRate(int capacity) {
        double c = 1.0 / capacity;
        if (Math.abs(c) > 0.00000001) {
            return c;
        }
        // http://www.cs.princeton.edu/courses/archive/spring02/cs493/lec7.pdf
        return Math.pow(0.6185, Integer.MAX_VALUE / (double) capacity);
    }

    // ==================== Built-in Hashes ====================

    private static <T> ToIntFunction<? super T> builtInHash(Class<T> type) {
        if (type == String.class) {
            return item -> hashString((String) item);
        }
        if (type == Integer.class) {
            return item -> hashInt32((Integer) item);
        }
        if (type == Long.class) {
            return item -> hashInt32(Long.hashCode((Long) item));
        }
        throw new FilterConstructionException(
                "Please provide a hash function for element type " + type.getName()
                        + ", built-in hashes exist only for String, Integer and Long",
                FilterConstructionException.MISSING_HASH_FUNCTION);
    }

    /**
     * Thomas Wang's 32-bit integer hash, v3.1.
     */
    public static int hashInt32(int input) {
        int x = input;
        x = ~x + (x << 15);
        x = x ^ (x >> 12);
        x = x + (x << 2);
        x = x ^ (x >> 4);
        x = x * 2057;
        x = x ^ (x >> 16);
        return x;
    }

    /**
     * Bob Jenkins' one-at-a-time string hash.
     */
    public static int hashString(String input) {
        int hash = 0;
        for (int i = 0; i < input.length(); i++) {
            hash += input.charAt(i);
            hash += (hash << 10);
            hash ^= (hash >> 6);
        }
        hash += (hash << 3);
        hash ^= (hash >> 11);
        hash += (hash << 15);
        return hash;
    }
}
