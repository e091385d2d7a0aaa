package com.ringcache.cluster;

import com.ringcache.metric.Counter;
import com.ringcache.metric.MetricsRegistry;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Bu düğümün küme hakkındaki görünümüdür. Her üye için en güncel
 * {@link NodeInfo}, en son haber alınma zamanı ve mevcut duruma geçiş zamanı
 * tutulur.
 *
 * <p>Durum makinesi:
 * <ul>
 *     <li>ALIVE → SUSPECT: {@code nodeTimeout} boyunca ne yoklama yanıtı ne de gelen yoklama</li>
 *     <li>SUSPECT → ALIVE: doğrudan temas ya da daha yüksek enkarnasyonla gelen dedikodu</li>
 *     <li>SUSPECT → DEAD: {@code suspectTimeout} boyunca çürütme gelmemesi</li>
 *     <li>DEAD → ALIVE: yalnızca daha yüksek enkarnasyonla yeniden katılım</li>
 * </ul>
 * Gossip birleştirmesi, yoklama sonuçları ve zaman aşımı taraması aynı kilit
 * altında sıralanır. Dinleyiciler kilit bırakıldıktan sonra bilgilendirilir.
 */
public final class MembershipTable
{
    private static final Logger LOG = Logger.getLogger(MembershipTable.class);

    private final ClusterState local;
    private final LongSupplier clock;
    private final long nodeTimeoutMillis;
    private final long suspectTimeoutMillis;
    private final long deadRetentionMillis;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Member> members = new HashMap<>();
    private final List<MembershipListener> listeners = new CopyOnWriteArrayList<>();
    private final Counter transitions;
    private final Counter probeFailures;

    /**
     * @param deadRetentionMillis ölü üyelerin tabloda kalma süresi; sıfır veya negatifse süresiz
     */
    public MembershipTable(ClusterState local,
                           LongSupplier clock,
                           long nodeTimeoutMillis,
                           long suspectTimeoutMillis,
                           long deadRetentionMillis,
                           MetricsRegistry metrics)
    {
        this.local = Objects.requireNonNull(local, "local");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nodeTimeoutMillis = nodeTimeoutMillis;
        this.suspectTimeoutMillis = suspectTimeoutMillis;
        this.deadRetentionMillis = deadRetentionMillis;
        MetricsRegistry registry = metrics != null ? metrics : new MetricsRegistry();
        this.transitions = registry.counter("membership_transitions");
        this.probeFailures = registry.counter("probe_failures");
    }

    public void addListener(MembershipListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public String localNodeId()
    {
        return local.localNodeId();
    }

    /**
     * Bir eşten gelen üyelik görünümünü çatışma kuralıyla birleştirir. Yerel
     * düğümün şüpheli veya ölü ilan edildiği görülürse enkarnasyon artırılarak
     * çürütülür.
     *
     * @return tabloda en az bir değişiklik olduysa {@code true}
     */
    public boolean merge(Collection<NodeInfo> remote)
    {
        List<Transition> changes = new ArrayList<>();
        lock.lock();
        try {
            long now = clock.getAsLong();
            for (NodeInfo incoming : remote) {
                if (local.isLocal(incoming.id())) {
                    refuteIfNeeded(incoming);
                    continue;
                }
                Member member = members.get(incoming.id());
                if (member == null) {
                    members.put(incoming.id(), new Member(incoming, now));
                    changes.add(new Transition(null, incoming));
                    continue;
                }
                if (!incoming.supersedes(member.info)) {
                    continue;
                }
                NodeInfo previous = member.info;
                member.info = incoming;
                if (incoming.incarnation() > previous.incarnation()) {
                    // yeni enkarnasyon taze bir canlılık kanıtıdır
                    member.lastHeard = now;
                }
                if (incoming.state() != previous.state()) {
                    member.stateSince = now;
                }
                changes.add(new Transition(previous, incoming));
            }
        } finally {
            lock.unlock();
        }
        publish(changes);
        return !changes.isEmpty();
    }

    /**
     * Yerel düğümün kendi görünümünü gölgeleyebilecek raporlar çürütülür.
     * Yeniden başlayan düğüm önceki çalıştırmadan kalan enkarnasyonu bu yolla aşar.
     */
    private void refuteIfNeeded(NodeInfo aboutMe)
    {
        long current = local.incarnation();
        boolean outranks = aboutMe.incarnation() > current;
        boolean suspected = aboutMe.state() != NodeState.ALIVE && aboutMe.incarnation() >= current;
        boolean staleAddress = aboutMe.incarnation() == current && !sameEndpoint(aboutMe, local.localNode());
        if (outranks || suspected || staleAddress) {
            long next = local.refute(aboutMe.incarnation());
            LOG.infof("Refuting %s report about this node at incarnation %d (%s); now at %d",
                    aboutMe.state(), aboutMe.incarnation(), aboutMe.address(), next);
        }
    }

    private static boolean sameEndpoint(NodeInfo a, NodeInfo b)
    {
        return a.host().equals(b.host()) && a.port() == b.port() && a.apiPort() == b.apiPort();
    }

    /**
     * Üyeden doğrudan haber alındığını kaydeder (yoklama yanıtı ya da gelen
     * yoklama). Şüpheli üye tekrar canlı sayılır; ölü üye ise ancak daha yüksek
     * enkarnasyonla geri dönebilir.
     */
    public void recordHeard(String nodeId)
    {
        Transition change = null;
        lock.lock();
        try {
            Member member = members.get(nodeId);
            if (member == null) {
                return;
            }
            long now = clock.getAsLong();
            member.lastHeard = now;
            if (member.info.state() == NodeState.SUSPECT) {
                NodeInfo previous = member.info;
                member.info = previous.withState(NodeState.ALIVE);
                member.stateSince = now;
                change = new Transition(previous, member.info);
            }
        } finally {
            lock.unlock();
        }
        if (change != null) {
            publish(List.of(change));
        }
    }

    public void recordProbeFailure(String nodeId)
    {
        probeFailures.inc();
        LOG.debugf("Probe to %s failed", nodeId);
    }

    /**
     * Zaman aşımlarını uygular ve gerçekleşen geçişleri döndürür. Saklama süresi
     * tanımlıysa süresi dolmuş ölü üyeler tablodan temizlenir.
     */
    public List<NodeInfo> detectFailures()
    {
        List<Transition> changes = new ArrayList<>();
        lock.lock();
        try {
            long now = clock.getAsLong();
            var iterator = members.values().iterator();
            while (iterator.hasNext()) {
                Member member = iterator.next();
                NodeInfo info = member.info;
                switch (info.state()) {
                    case ALIVE -> {
                        if (now - member.lastHeard > nodeTimeoutMillis) {
                            member.info = info.withState(NodeState.SUSPECT);
                            member.stateSince = now;
                            changes.add(new Transition(info, member.info));
                        }
                    }
                    case SUSPECT -> {
                        if (now - member.stateSince > suspectTimeoutMillis) {
                            member.info = info.withState(NodeState.DEAD);
                            member.stateSince = now;
                            changes.add(new Transition(info, member.info));
                        }
                    }
                    case DEAD -> {
                        if (deadRetentionMillis > 0 && now - member.stateSince > deadRetentionMillis) {
                            iterator.remove();
                            changes.add(new Transition(info, null));
                        }
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        publish(changes);
        List<NodeInfo> result = new ArrayList<>(changes.size());
        for (Transition change : changes) {
            result.add(change.current != null ? change.current : change.previous);
        }
        return result;
    }

    /** Yerel düğüm dahil tüm üyeler, kimliğe göre sıralı. */
    public List<NodeInfo> snapshot()
    {
        List<NodeInfo> out = new ArrayList<>();
        lock.lock();
        try {
            for (Member member : members.values()) {
                out.add(member.info);
            }
        } finally {
            lock.unlock();
        }
        out.add(local.localNode());
        out.sort(Comparator.comparing(NodeInfo::id));
        return out;
    }

    /** Halkaya girmeye uygun üyeler: ölü olmayanlar ve yerel düğüm. */
    public List<NodeInfo> routableNodes()
    {
        List<NodeInfo> out = new ArrayList<>();
        for (NodeInfo info : snapshot()) {
            if (info.routable()) {
                out.add(info);
            }
        }
        return out;
    }

    /** Yoklanabilecek uzak üyeler: yerel düğüm ve ölüler hariç. */
    public List<NodeInfo> probeCandidates()
    {
        List<NodeInfo> out = new ArrayList<>();
        lock.lock();
        try {
            for (Member member : members.values()) {
                if (member.info.routable()) {
                    out.add(member.info);
                }
            }
        } finally {
            lock.unlock();
        }
        out.sort(Comparator.comparing(NodeInfo::id));
        return out;
    }

    public Optional<NodeInfo> get(String nodeId)
    {
        if (local.isLocal(nodeId)) {
            return Optional.of(local.localNode());
        }
        lock.lock();
        try {
            Member member = members.get(nodeId);
            return member == null ? Optional.empty() : Optional.of(member.info);
        } finally {
            lock.unlock();
        }
    }

    public Optional<NodeInfo> findByAddress(String host, int port)
    {
        for (NodeInfo info : snapshot()) {
            if (info.host().equals(host) && info.port() == port) {
                return Optional.of(info);
            }
        }
        return Optional.empty();
    }

    private void publish(List<Transition> changes)
    {
        for (Transition change : changes) {
            transitions.inc();
            logTransition(change);
            for (MembershipListener listener : listeners) {
                try {
                    listener.onTransition(change.previous, change.current);
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Membership listener failed for %s", change);
                }
            }
        }
    }

    private static void logTransition(Transition change)
    {
        if (change.previous == null) {
            NodeInfo node = change.current;
            LOG.infof("Discovered cluster member %s at %s (state %s, incarnation %d)",
                    node.id(), node.address(), node.state(), node.incarnation());
        } else if (change.current == null) {
            LOG.infof("Purged dead cluster member %s", change.previous.id());
        } else if (change.previous.state() != change.current.state()) {
            LOG.infof("Cluster member %s is now %s (incarnation %d)",
                    change.current.id(), change.current.state(), change.current.incarnation());
        } else {
            LOG.debugf("Cluster member %s moved to incarnation %d",
                    change.current.id(), change.current.incarnation());
        }
    }

    private static final class Member
    {
        private NodeInfo info;
        private long lastHeard;
        private long stateSince;

        private Member(NodeInfo info, long now)
        {
            this.info = info;
            this.lastHeard = now;
            this.stateSince = now;
        }
    }

    private record Transition(NodeInfo previous, NodeInfo current) {}
}
