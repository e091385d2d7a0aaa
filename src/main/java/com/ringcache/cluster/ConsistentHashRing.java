package com.ringcache.cluster;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Düğümleri ve anahtarları sabit bir hash halkasına yerleştiren değişmez veri
 * yapısıdır. Her fiziksel düğüm {@code id#i} baytlarından türetilen
 * {@code virtualNodes} konumla temsil edilir; anahtarın sahibi, anahtar
 * hash'ine eşit veya ondan büyük ilk konumun sahibidir ve en büyük değerden
 * sonra halkanın başına sarılır.
 *
 * <p>Aynı düğüm kimlikleri ve aynı sanal düğüm sayısı her zaman aynı halkayı
 * üretir. Üyelik değiştiğinde halka yerinde değiştirilmez, yenisi kurulur.
 */
public final class ConsistentHashRing<N>
{
    private static final Comparator<VirtualNode> ORDER = (a, b) -> {
        int byHash = Long.compareUnsigned(a.hash(), b.hash());
        return byHash != 0 ? byHash : a.owner().compareTo(b.owner());
    };

    private final HashFn hash;
    private final int virtualNodes;
    private final long[] positions;
    private final String[] owners;
    private final Map<String, N> nodes;

    private ConsistentHashRing(HashFn hash, int virtualNodes, long[] positions, String[] owners, Map<String, N> nodes)
    {
        this.hash = hash;
        this.virtualNodes = virtualNodes;
        this.positions = positions;
        this.owners = owners;
        this.nodes = nodes;
    }

    public static <N> ConsistentHashRing<N> build(HashFn hash, int virtualNodes, Map<String, N> nodesById)
    {
        int vnodes = Math.max(1, virtualNodes);
        // kimlik sırası girdinin sırasından bağımsız olsun
        Map<String, N> sorted = new TreeMap<>(nodesById);

        List<VirtualNode> points = new ArrayList<>(sorted.size() * vnodes);
        for (String id : sorted.keySet()) {
            byte[] idBytes = id.getBytes(StandardCharsets.UTF_8);
            for (int i = 0; i < vnodes; i++) {
                points.add(new VirtualNode(hash.hash(join(idBytes, i)), id));
            }
        }
        points.sort(ORDER);

        long[] positions = new long[points.size()];
        String[] owners = new String[points.size()];
        for (int i = 0; i < points.size(); i++) {
            positions[i] = points.get(i).hash();
            owners[i] = points.get(i).owner();
        }
        return new ConsistentHashRing<>(hash, vnodes, positions, owners,
                Collections.unmodifiableMap(new LinkedHashMap<>(sorted)));
    }

    public static <N> ConsistentHashRing<N> empty(HashFn hash, int virtualNodes)
    {
        return build(hash, virtualNodes, Map.of());
    }

    public boolean isEmpty()
    {
        return positions.length == 0;
    }

    public Optional<N> primaryOwner(byte[] key)
    {
        return primaryOwnerId(key).map(nodes::get);
    }

    public Optional<String> primaryOwnerId(byte[] key)
    {
        if (positions.length == 0) {
            return Optional.empty();
        }
        return Optional.of(owners[indexFor(hash.hash(key))]);
    }

    /**
     * Hash değerine eşit veya büyük ilk konumun indeksini işaretsiz ikili arama
     * ile bulur; hiçbiri yoksa halkanın başına sarar.
     */
    private int indexFor(long keyHash)
    {
        int low = 0;
        int high = positions.length - 1;
        int found = positions.length;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (Long.compareUnsigned(positions[mid], keyHash) >= 0) {
                found = mid;
                high = mid - 1;
            } else {
                low = mid + 1;
            }
        }
        return found == positions.length ? 0 : found;
    }

    public List<VirtualNode> virtualNodes()
    {
        List<VirtualNode> out = new ArrayList<>(positions.length);
        for (int i = 0; i < positions.length; i++) {
            out.add(new VirtualNode(positions[i], owners[i]));
        }
        return out;
    }

    public Map<String, N> nodes()
    {
        return nodes;
    }

    public int virtualNodesPerNode()
    {
        return virtualNodes;
    }

    @Override
    public String toString()
    {
        return "ConsistentHashRing" + Arrays.toString(nodes.keySet().toArray()) + " x" + virtualNodes;
    }

    private static byte[] join(byte[] id, int i)
    {
        byte[] suffix = ("#" + i).getBytes(StandardCharsets.UTF_8);
        byte[] combined = new byte[id.length + suffix.length];
        System.arraycopy(id, 0, combined, 0, id.length);
        System.arraycopy(suffix, 0, combined, id.length, suffix.length);
        return combined;
    }
}
