package com.ringcache.api;

import com.ringcache.cluster.ClusterState;
import com.ringcache.cluster.MembershipTable;
import com.ringcache.cluster.NodeInfo;
import com.ringcache.cluster.RequestCoordinator;
import com.ringcache.cluster.RingManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/**
 * Bu düğümün küme görünümünü JSON olarak sunar.
 */
@Path("/cluster")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ClusterResource
{
    private final ClusterState clusterState;
    private final MembershipTable membership;
    private final RingManager ring;
    private final RequestCoordinator coordinator;

    @Inject
    public ClusterResource(ClusterState clusterState,
                           MembershipTable membership,
                           RingManager ring,
                           RequestCoordinator coordinator)
    {
        this.clusterState = clusterState;
        this.membership = membership;
        this.ring = ring;
        this.coordinator = coordinator;
    }

    @GET
    @Path("members")
    public MembersView members()
    {
        List<MemberView> members = membership.snapshot().stream()
                .map(node -> MemberView.of(node, clusterState.isLocal(node.id())))
                .toList();
        return new MembersView(clusterState.localNodeId(), ring.current().nodes().size(), members);
    }

    @GET
    @Path("route/{key}")
    public RouteView route(@PathParam("key") String key)
    {
        NodeInfo owner = coordinator.route(key);
        return new RouteView(key, owner.id(), owner.address(), owner.apiAddress(), clusterState.isLocal(owner.id()));
    }

    public record MembersView(String localNodeId, int ringNodes, List<MemberView> members) {}

    public record MemberView(String id, String address, String apiAddress, long incarnation, String state, boolean local)
    {
        static MemberView of(NodeInfo node, boolean local)
        {
            return new MemberView(node.id(), node.address(), node.apiAddress(), node.incarnation(),
                    node.state().name(), local);
        }
    }

    public record RouteView(String key, String ownerId, String ownerAddress, String ownerApiAddress, boolean local) {}
}
