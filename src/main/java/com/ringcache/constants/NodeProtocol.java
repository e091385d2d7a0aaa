package com.ringcache.constants;

public interface NodeProtocol
{
    // 'P' komutu, gossip turunda üyelik tablosunu taşıyan doğrudan yoklamadır (PING).
    byte CMD_PING = 'P';

    // 'G' komutu, sahibi olunmayan bir anahtar için yönlendirilmiş GET isteğidir.
    byte CMD_GET = 'G';

    // 'S' komutu, yönlendirilmiş SET isteğidir.
    byte CMD_SET = 'S';

    // 'D' komutu, yönlendirilmiş DELETE isteğidir.
    byte CMD_DELETE = 'D';

    // 'A' yanıtı, PING'e karşılık yanıtlayanın üyelik tablosunu döndürür (ACK).
    byte RESP_ACK = 'A';

    // 'H' yanıtı, GET sonucunda değerin bulunduğunu (HIT) bildirir.
    byte RESP_HIT = 'H';

    // 'M' yanıtı, GET sonucunda değerin bulunamadığını (MISS) gösterir.
    byte RESP_MISS = 'M';

    // 'T' yanıtı, boolean dönen işlemlerde TRUE sonucunu ifade eder.
    byte RESP_TRUE = 'T';

    // 'F' yanıtı, boolean dönen işlemlerde FALSE sonucunu ifade eder.
    byte RESP_FALSE = 'F';

    // 'R' yanıtı, alıcının anahtarın sahibi olmadığını ve kendi gördüğü sahibi bildirir (MISROUTED).
    byte RESP_MISROUTED = 'R';

    // 'E' yanıtı, alıcıda yerel bir depolama hatası oluştuğunu bildirir.
    byte RESP_ERROR = 'E';
}
