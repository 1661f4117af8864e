package io.flowdetect.database;

import io.flowdetect.compile.Situation;
import io.flowdetect.compile.TimestepLayout;
import io.flowdetect.plaquette.Plaquettes;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Identifies a situation by content.
 * <p>
 * Each time step is stored as a window of local indices, numbered 1, 2, ... in order of first
 * appearance (row by row, 0 still meaning "no plaquette"), plus the content digest of the
 * plaquette behind each local index. Two situations with the same plaquettes arranged the same
 * way therefore have equal keys, whatever their position in the template and whatever indices
 * their plaquettes were registered under.
 */
public final class DetectorDatabaseKey {

    /**
     * One time step of a key.
     *
     * @param indices    local plaquette indices, as {@code [row][column]}
     * @param plaquettes digest of the plaquette behind local index {@code i + 1}
     */
    public record Layer(List<List<Integer>> indices, List<String> plaquettes) {
        public Layer {
            if (indices == null || plaquettes == null) {
                throw new IllegalArgumentException("A key layer needs indices and plaquettes");
            }
            indices = indices.stream().map(List::copyOf).toList();
            plaquettes = List.copyOf(plaquettes);
        }
    }

    private final List<Layer> layers;

    private DetectorDatabaseKey(List<Layer> layers) {
        if (layers.isEmpty() || layers.size() > 2) {
            throw new IllegalArgumentException("A key spans 1 or 2 time steps, got " + layers.size());
        }
        this.layers = List.copyOf(layers);
    }

    public static DetectorDatabaseKey of(List<Layer> layers) {
        return new DetectorDatabaseKey(layers);
    }

    /**
     * @throws IllegalArgumentException if the numbers of sub-templates and plaquettes differ
     */
    public static DetectorDatabaseKey of(List<int[][]> subtemplates, List<Plaquettes> plaquettes) {
        if (subtemplates.size() != plaquettes.size()) {
            throw new IllegalArgumentException("DetectorDatabaseKey can only store an equal number of subtemplates "
                    + "and plaquettes. Got " + subtemplates.size() + " subtemplates and " + plaquettes.size()
                    + " plaquettes.");
        }
        List<Layer> layers = new ArrayList<>(subtemplates.size());
        for (int t = 0; t < subtemplates.size(); t++) {
            layers.add(canonicalLayer(subtemplates.get(t), plaquettes.get(t)));
        }
        return new DetectorDatabaseKey(layers);
    }

    public static DetectorDatabaseKey of(Situation situation) {
        List<int[][]> subtemplates = new ArrayList<>();
        List<Plaquettes> plaquettes = new ArrayList<>();
        for (TimestepLayout layout : situation.timesteps()) {
            subtemplates.add(layout.subtemplate());
            plaquettes.add(layout.plaquettes());
        }
        return of(subtemplates, plaquettes);
    }

    private static Layer canonicalLayer(int[][] subtemplate, Plaquettes plaquettes) {
        Map<String, Integer> localByDigest = new LinkedHashMap<>();
        Map<Integer, String> digestByIndex = new HashMap<>();
        List<List<Integer>> indices = new ArrayList<>(subtemplate.length);
        for (int[] row : subtemplate) {
            List<Integer> localRow = new ArrayList<>(row.length);
            for (int index : row) {
                if (index == Plaquettes.EMPTY_INDEX) {
                    localRow.add(0);
                    continue;
                }
                String digest = digestByIndex.computeIfAbsent(index, i -> sha256Hex(plaquettes.fingerprint(i)));
                localRow.add(localByDigest.computeIfAbsent(digest, d -> localByDigest.size() + 1));
            }
            indices.add(localRow);
        }
        return new Layer(indices, new ArrayList<>(localByDigest.keySet()));
    }

    public List<Layer> layers() {
        return layers;
    }

    /**
     * SHA-256 of the key content, stable from one run to the next.
     */
    public String reliableHash() {
        return sha256Hex(canonicalText());
    }

    private String canonicalText() {
        StringBuilder sb = new StringBuilder();
        for (Layer layer : layers) {
            sb.append(layer.indices()).append('#').append(String.join(",", layer.plaquettes())).append(';');
        }
        return sb.toString();
    }

    static String sha256Hex(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectorDatabaseKey that)) return false;
        return layers.equals(that.layers);
    }

    @Override
    public int hashCode() {
        return layers.hashCode();
    }

    @Override
    public String toString() {
        return "DetectorDatabaseKey[" + reliableHash().substring(0, 12) + "]";
    }
}
