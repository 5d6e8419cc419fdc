package com.splitttr.wiki.rest;

import com.splitttr.wiki.dto.ForkRequest;
import com.splitttr.wiki.dto.PageResponse;
import com.splitttr.wiki.service.AuthService;
import com.splitttr.wiki.service.VersioningService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BranchResource {

    @Inject
    VersioningService service;

    @Inject
    AuthService auth;

    @GET
    @Path("/branches")
    public List<String> allBranches() {
        return service.listAllBranches();
    }

    @GET
    @Path("/pages/{title}/branches")
    public List<String> branchesOf(@PathParam("title") String title) {
        return service.listBranches(title);
    }

    @POST
    @Path("/pages/{title}/branches")
    public Response fork(@PathParam("title") String title, ForkRequest req) {
        if (req == null) throw new VersioningService.BadRequestException("body required");
        auth.requireUsername();
        var page = service.fork(title, req.branchName(), req.sourceBranch());
        return Response.status(Response.Status.CREATED)
            .entity(PageResponse.from(page))
            .build();
    }

    @DELETE
    @Path("/pages/{title}/branches/{branch}")
    public Response deleteBranch(@PathParam("title") String title, @PathParam("branch") String branch) {
        auth.requireUsername();
        service.deleteBranch(title, branch);
        return Response.noContent().build();
    }
}
