package com.splitttr.wiki.rest;

import com.splitttr.wiki.dto.*;
import com.splitttr.wiki.service.AuthService;
import com.splitttr.wiki.service.VersioningService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/pages")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PageResource {

    @Inject
    VersioningService service;

    @Inject
    AuthService auth;

    // With q set the listing becomes a title/content search; "/search" would shadow a page of that name.
    @GET
    public List<PageResponse> list(@QueryParam("q") String q,
                                   @QueryParam("branch") @DefaultValue("main") String branch,
                                   @QueryParam("limit") @DefaultValue("100") int limit) {
        var found = q == null ? service.listPages(branch, limit) : service.searchPages(q, branch, limit);
        return found.stream().map(PageResponse::from).toList();
    }

    @POST
    public Response create(PageCreateRequest req) {
        if (req == null) throw new VersioningService.BadRequestException("body required");
        var page = service.create(req.title(), req.content(), auth.currentUsername(), req.branch(), req.editSummary());
        return Response.status(Response.Status.CREATED)
            .entity(PageResponse.from(page))
            .build();
    }

    @GET
    @Path("/{title}")
    public Response get(@PathParam("title") String title,
                        @QueryParam("branch") @DefaultValue("main") String branch) {
        // a missing page is an invitation to create it, not an error page
        return service.get(title, branch)
            .map(page -> Response.ok(PageResponse.from(page)).build())
            .orElse(Response.status(Response.Status.NOT_FOUND)
                .entity(new ExceptionMappers.ErrorBody("Page does not exist yet"))
                .build());
    }

    @PUT
    @Path("/{title}")
    public PageResponse update(@PathParam("title") String title, PageUpdateRequest req) {
        if (req == null) throw new VersioningService.BadRequestException("body required");
        var page = service.update(title, req.content(), auth.currentUsername(), req.branch(), req.editSummary(),
            req.editPermission(), req.allowedUsers());
        return PageResponse.from(page);
    }

    @DELETE
    @Path("/{title}")
    public Response delete(@PathParam("title") String title) {
        auth.requireUsername();
        service.deletePage(title);
        return Response.noContent().build();
    }

    @POST
    @Path("/{title}/rename")
    public Response rename(@PathParam("title") String title, RenameRequest req) {
        if (req == null) throw new VersioningService.BadRequestException("body required");
        auth.requireUsername();
        service.rename(title, req.newTitle());
        return Response.noContent().build();
    }
}
