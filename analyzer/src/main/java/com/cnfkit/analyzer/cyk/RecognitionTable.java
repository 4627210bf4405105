package com.cnfkit.analyzer.cyk;

import com.cnfkit.analyzer.grammar.Grammar.Variable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upper-triangular CYK chart. Cell {@code (i, j)} maps every variable proven over tokens
 * {@code i..j} to the first witness found for it; later alternatives are not recorded.
 */
public final class RecognitionTable {

    public interface Witness {}

    /** The variable matched the literal token at {@code i == j}. */
    public record Literal(String token) implements Witness {}

    /** The variable split at {@code k} into {@code left} over {@code i..k} and {@code right} over {@code k+1..j}. */
    public record Split(int k, Variable left, Variable right) implements Witness {}

    private final int size;
    private final List<Map<Variable, Witness>> cells;

    RecognitionTable(int size) {
        this.size = size;
        this.cells = new ArrayList<>(size * size);
        for (int i = 0; i < size * size; i++) {
            cells.add(i / size <= i % size ? new LinkedHashMap<>() : Map.of());
        }
    }

    public int size() {
        return size;
    }

    public Map<Variable, Witness> cell(int i, int j) {
        return Collections.unmodifiableMap(cells.get(index(i, j)));
    }

    public boolean contains(int i, int j, Variable variable) {
        return cells.get(index(i, j)).containsKey(variable);
    }

    public Optional<Witness> witness(Variable variable, int i, int j) {
        return Optional.ofNullable(cells.get(index(i, j)).get(variable));
    }

    /** Records the witness unless the cell already proves {@code variable}. */
    boolean record(int i, int j, Variable variable, Witness witness) {
        return cells.get(index(i, j)).putIfAbsent(variable, witness) == null;
    }

    public int entryCount() {
        return cells.stream().mapToInt(Map::size).sum();
    }

    private int index(int i, int j) {
        if (i < 0 || j >= size || i > j) {
            throw new IndexOutOfBoundsException("no cell (" + i + ", " + j + ") in a table of size " + size);
        }
        return i * size + j;
    }
}
