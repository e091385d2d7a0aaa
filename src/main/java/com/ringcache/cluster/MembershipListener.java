package com.ringcache.cluster;

/**
 * Üyelik tablosundaki her durum geçişinden sonra, tablo kilidi bırakıldıktan
 * sonra çağrılır.
 */
@FunctionalInterface
public interface MembershipListener
{
    /**
     * @param previous önceki bilgi; üye ilk kez görülüyorsa {@code null}
     * @param current  yeni bilgi; üye tablodan temizlendiyse {@code null}
     */
    void onTransition(NodeInfo previous, NodeInfo current);
}
