package com.splitttr.wiki.rest;

import com.splitttr.wiki.dto.DiffResponse;
import com.splitttr.wiki.dto.PageResponse;
import com.splitttr.wiki.dto.VersionResponse;
import com.splitttr.wiki.service.AuthService;
import com.splitttr.wiki.service.VersioningService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/pages/{title}/history")
@Produces(MediaType.APPLICATION_JSON)
public class HistoryResource {

    @Inject
    VersioningService service;

    @Inject
    AuthService auth;

    @GET
    public List<VersionResponse> versions(@PathParam("title") String title,
                                          @QueryParam("branch") @DefaultValue("main") String branch,
                                          @QueryParam("limit") @DefaultValue("100") int limit) {
        return service.listVersions(title, branch, limit).stream().map(VersionResponse::from).toList();
    }

    @GET
    @Path("/compare")
    public DiffResponse compare(@PathParam("title") String title,
                                @QueryParam("branch") @DefaultValue("main") String branch,
                                @QueryParam("from") @DefaultValue("1") int from,
                                @QueryParam("to") @DefaultValue("0") int to) {
        return DiffResponse.from(service.compareVersions(title, branch, from, to));
    }

    @POST
    @Path("/{index}/restore")
    public Response restore(@PathParam("title") String title,
                            @PathParam("index") int index,
                            @QueryParam("branch") @DefaultValue("main") String branch) {
        String user = auth.requireUsername();
        var outcome = service.restoreVersion(title, branch, index, user);
        var page = service.get(title, branch).orElseThrow(VersioningService.NotFoundException::new);
        return Response.ok(PageResponse.from(page))
            .header("X-Restore-Outcome", outcome.name())
            .build();
    }
}
