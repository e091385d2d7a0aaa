package com.ringcache.cluster;

import java.util.Objects;

/**
 * Bir küme üyesinin kimliği, adresleri ve bu düğüm hakkında bilinen en güncel
 * enkarnasyon ile durum bilgisidir.
 *
 * @param port    gossip ve yönlendirme trafiğinin aktığı küme portu
 * @param apiPort istemcilere açık HTTP portu
 */
public record NodeInfo(String id, String host, int port, int apiPort, long incarnation, NodeState state)
{
    public NodeInfo
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(state, "state");
        if (id.isBlank()) {
            throw new IllegalArgumentException("node id must not be blank");
        }
        if (incarnation < 0) {
            throw new IllegalArgumentException("incarnation must be >= 0");
        }
    }

    public NodeInfo withState(NodeState newState)
    {
        return new NodeInfo(id, host, port, apiPort, incarnation, newState);
    }

    /**
     * Bu bilginin elde tutulan {@code current} bilgisinin yerini alıp almayacağını
     * belirler. Yüksek enkarnasyon her zaman kazanır; eşit enkarnasyonda yalnızca
     * daha ciddi bir durum kabul edilir. Dolayısıyla ölü bir üye ancak daha
     * yüksek bir enkarnasyonla geri dönebilir.
     */
    public boolean supersedes(NodeInfo current)
    {
        if (current == null) {
            return true;
        }
        if (incarnation != current.incarnation) {
            return incarnation > current.incarnation;
        }
        return state.moreSevereThan(current.state);
    }

    public boolean routable()
    {
        return state != NodeState.DEAD;
    }

    public String address()
    {
        return host + ":" + port;
    }

    public String apiAddress()
    {
        return host + ":" + apiPort;
    }
}
