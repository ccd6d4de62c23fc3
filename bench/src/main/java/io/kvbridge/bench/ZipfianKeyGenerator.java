// file: src/main/java/io/kvbridge/bench/ZipfianKeyGenerator.java
package io.kvbridge.bench;

import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Zipf-distributed key ids in [0, n): id 0 is the hottest key.
 * <p>
 * The cumulative distribution is built once; sampling is a binary search over
 * it with a uniform draw from {@link ThreadLocalRandom}, so one instance can be
 * shared by all issuing threads.
 */
public final class ZipfianKeyGenerator {

    private final double[] cdf;

    public ZipfianKeyGenerator(int n, double skew) {
        if (n <= 0) throw new IllegalArgumentException("n must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        double[] cumulative = new double[n];
        double total = 0.0;
        for (int rank = 1; rank <= n; rank++) {
            total += Math.pow(rank, -skew);
            cumulative[rank - 1] = total;
        }
        for (int i = 0; i < n; i++) {
            cumulative[i] /= total;
        }
        cumulative[n - 1] = 1.0;
        this.cdf = cumulative;
    }

    public int size() {
        return cdf.length;
    }

    public int nextKey() {
        double u = ThreadLocalRandom.current().nextDouble();
        int idx = Arrays.binarySearch(cdf, u);
        return idx >= 0 ? idx : Math.min(-idx - 1, cdf.length - 1);
    }
}
