package com.splitttr.presence.rest;

import com.splitttr.presence.dto.EditSessionRequest;
import com.splitttr.presence.dto.EditSessionResponse;
import com.splitttr.presence.dto.RosterResponse;
import com.splitttr.presence.dto.StatusResponse;
import com.splitttr.presence.entity.EditSession;
import com.splitttr.presence.service.AuthService;
import com.splitttr.presence.service.PresenceService;
import com.splitttr.presence.session.PresenceCoordinator;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.List;

@Path("/api/pages/{title}/edit-session")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EditSessionResource {

    private static final Logger LOG = Logger.getLogger(EditSessionResource.class);

    @Inject
    PresenceService presence;

    @Inject
    PresenceCoordinator coordinator;

    @Inject
    AuthService auth;

    @POST
    public EditSessionResponse create(@PathParam("title") String title, EditSessionRequest req) {
        requireEnabled();
        var caller = auth.requireCaller();
        var body = req == null ? new EditSessionRequest(null, null, null) : req;
        var grant = presence.createSession(title, body.branch(), body.mode(), body.clientId(),
            caller.userId(), caller.username());
        coordinator.broadcastRoster(title, body.branch());
        return EditSessionResponse.from(grant);
    }

    @DELETE
    @Path("/{sessionId}")
    public StatusResponse release(@PathParam("title") String title,
                                  @PathParam("sessionId") String sessionId,
                                  @QueryParam("branch") String branch) {
        requireEnabled();
        var caller = auth.requireCaller();
        // the lease knows its branch better than the query string does
        String leaseBranch = presence.findSession(sessionId, caller.userId())
            .map(s -> s.branch)
            .orElse(PresenceService.normalizeBranch(branch));
        presence.release(sessionId, caller.userId());
        coordinator.broadcastRoster(title, leaseBranch);
        return new StatusResponse("released");
    }

    @GET
    @Path("/roster")
    public RosterResponse roster(@PathParam("title") String title, @QueryParam("branch") String branch) {
        requireEnabled();
        auth.requireCaller();
        try {
            return new RosterResponse(presence.getRoster(title, branch));
        } catch (PresenceService.PresenceOfflineException e) {
            LOG.warnf("Roster for %s unavailable, showing no editors: %s", title, e.getMessage());
            return new RosterResponse(List.of());
        }
    }

    private void requireEnabled() {
        if (!presence.isEnabled()) {
            throw new NotFoundException();
        }
    }
}
