package com.solusoft.ai.healthsim.common.generator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;

/**
 * Single source of randomness and time for a generator.
 * <p>
 * Everything a generator fabricates is drawn from the one seeded {@link Random} held here, so two
 * contexts with the same seed and clock yield the same sequence of values. Identifiers come from a
 * seed-dependent base plus a running sequence, which keeps them unique within the context.
 */
public class GenerationContext {

    private final long seed;
    private final Random random;
    private final Clock clock;
    private final long idBase;
    private long sequence;

    public GenerationContext(long seed) {
        this(seed, Clock.systemDefaultZone());
    }

    public GenerationContext(long seed, Clock clock) {
        this.seed = seed;
        this.random = new Random(seed);
        this.clock = clock;
        this.idBase = 10_000_000L + random.nextInt(80_000_000);
    }

    public long seed() {
        return seed;
    }

    public Clock clock() {
        return clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /** Inclusive on both ends. */
    public int between(int min, int max) {
        if (min > max) {
            throw new InvalidRequestException("Invalid bounds [" + min + ", " + max + "]");
        }
        return min + random.nextInt(max - min + 1);
    }

    public double nextDouble() {
        return random.nextDouble();
    }

    public double between(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    public <T> T pick(List<T> values) {
        if (values.isEmpty()) {
            throw new InvalidRequestException("Cannot pick from an empty list");
        }
        return values.get(random.nextInt(values.size()));
    }

    public <T> T pick(T[] values) {
        return pick(List.of(values));
    }

    /**
     * Picks {@code count} distinct elements, keeping their original order.
     */
    public <T> List<T> sample(List<T> values, int count) {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            indexes.add(i);
        }
        int n = Math.min(count, values.size());
        List<Integer> chosen = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            chosen.add(indexes.remove(random.nextInt(indexes.size())));
        }
        chosen.sort(Integer::compareTo);
        List<T> result = new ArrayList<>();
        for (Integer index : chosen) {
            result.add(values.get(index));
        }
        return result;
    }

    public LocalDate dateBetween(LocalDate start, LocalDate end) {
        long days = ChronoUnit.DAYS.between(start, end);
        if (days < 0) {
            throw new InvalidRequestException("Start date " + start + " is after end date " + end);
        }
        return start.plusDays(days == 0 ? 0 : (long) (random.nextDouble() * (days + 1)));
    }

    public BigDecimal money(double min, double max) {
        return BigDecimal.valueOf(between(min, max)).setScale(2, RoundingMode.HALF_UP);
    }

    public String digits(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(random.nextInt(10));
        }
        return sb.toString();
    }

    /**
     * Prefix followed by eight digits, unique for this context.
     */
    public String nextId(String prefix) {
        sequence++;
        return prefix + String.format("%08d", (idBase + sequence) % 100_000_000L);
    }
}
