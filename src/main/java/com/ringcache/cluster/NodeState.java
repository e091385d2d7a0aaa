package com.ringcache.cluster;

/**
 * Üyelerin canlılık durumu. Sıralama ciddiyete göredir: aynı enkarnasyonda
 * daha ciddi durum kazanır.
 */
public enum NodeState
{
    ALIVE((byte) 0),
    SUSPECT((byte) 1),
    DEAD((byte) 2);

    private final byte code;

    NodeState(byte code)
    {
        this.code = code;
    }

    public byte code()
    {
        return code;
    }

    public boolean moreSevereThan(NodeState other)
    {
        return ordinal() > other.ordinal();
    }

    public static NodeState fromCode(byte code)
    {
        for (NodeState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        throw new IllegalArgumentException("unknown node state code " + code);
    }
}
