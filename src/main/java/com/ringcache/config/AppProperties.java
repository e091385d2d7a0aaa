package com.ringcache.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * olarak sunar. Alt arayüzler düğüm kimliğini ve portlarını, küme üyeliği ile
 * halka ayarlarını, depolama dizinini ve bakım aralıklarını, ağ iş parçacığı
 * sayılarını ve metrik raporlamasını gruplar.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    NodeConfig node();
    Cluster cluster();
    Storage storage();
    Network network();
    Metrics metrics();

    interface NodeConfig {
        /** Boş bırakılırsa {@code host:port} kullanılır. */
        Optional<String> id();

        /** Diğer üyelere ilan edilen adres. */
        @WithDefault("127.0.0.1")
        String host();

        @WithDefault("0.0.0.0")
        String bindHost();

        /** Gossip ve yönlendirme trafiğinin aktığı küme portu. */
        @WithDefault("7946")
        int port();

        @WithDefault("3031")
        int apiPort();
    }

    interface Cluster {
        /** {@code host:port} biçiminde tohum düğümler; boşsa bu düğüm kümenin başlangıç noktasıdır. */
        Optional<List<String>> seeds();

        @WithDefault("10")
        int virtualNodes();

        @WithDefault("1")
        long gossipIntervalSeconds();

        @WithDefault("10")
        long nodeTimeoutSeconds();

        @WithDefault("10")
        long suspectTimeoutSeconds();

        @WithDefault("3")
        int probeFanout();

        @WithDefault("2000")
        long requestTimeoutMillis();

        /** Tanımsızsa ölü üyeler tablodan hiç silinmez. */
        Optional<Long> deadRetentionSeconds();
    }

    interface Storage {
        @WithDefault("cache_storage")
        String directory();

        @WithDefault("true")
        boolean fsync();

        @WithDefault("60")
        long checkpointIntervalSeconds();

        @WithDefault("500")
        long reclaimIntervalMillis();

        @WithDefault("true")
        boolean verifyOnStartup();
    }

    interface Network {
        @WithDefault("0")
        int eventLoopThreads();

        @WithDefault("16")
        int workerThreads();
    }

    interface Metrics {
        @WithDefault("0")
        long reportIntervalSeconds();
    }
}
