package com.ammann.imagebuilder.resource;

import com.ammann.imagebuilder.build.ImageBuildService;
import com.ammann.imagebuilder.dto.BuildRequestDTO;
import com.ammann.imagebuilder.dto.BuildResultDTO;
import com.ammann.imagebuilder.dto.ImageInfoDTO;
import com.ammann.imagebuilder.properties.ApiProperties;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for building configured images.
 *
 * <p>A build request runs synchronously on the request's worker thread and returns once
 * every requested image has been built or the first one failed.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Image Builds", description = "Build images from configured definitions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed("ADMIN_ROLE")
public class BuildResource {

    @Inject Logger logger;

    @Inject ImageBuildService imageBuildService;

    @POST
    @Path(ApiProperties.Builds.BASE)
    @Operation(
            summary = "Build images",
            description = "Builds the named images in order and stops at the first failure")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "All images built",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = BuildResultDTO.class))),
        @APIResponse(
                responseCode = "400",
                description = "Invalid request or malformed image definition"),
        @APIResponse(responseCode = "401", description = "Unauthorized"),
        @APIResponse(responseCode = "403", description = "Forbidden - requires ADMIN_ROLE"),
        @APIResponse(responseCode = "404", description = "No definition for a requested image"),
        @APIResponse(responseCode = "422", description = "A build container exited non-zero"),
        @APIResponse(responseCode = "502", description = "Docker daemon error"),
        @APIResponse(responseCode = "504", description = "Timed out waiting for a container")
    })
    public List<BuildResultDTO> build(@NotNull @Valid BuildRequestDTO request) {
        logger.infof("Build requested for %s", request.images());
        return imageBuildService.buildImages(request.images(), request.envOrEmpty());
    }

    @GET
    @Path(ApiProperties.Images.BASE)
    @Operation(summary = "List images", description = "Returns the configured image definitions")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Configured images",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = ImageInfoDTO.class))),
        @APIResponse(responseCode = "401", description = "Unauthorized"),
        @APIResponse(responseCode = "403", description = "Forbidden - requires ADMIN_ROLE")
    })
    public List<ImageInfoDTO> listImages() {
        logger.debug("Listing configured images");
        return imageBuildService.listImages();
    }
}
