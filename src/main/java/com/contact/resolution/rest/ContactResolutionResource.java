package com.contact.resolution.rest;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.core.exception.ContactResolutionException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.merge.BatchMergeResult;
import com.contact.resolution.merge.MergeResult;
import com.contact.resolution.rest.dto.BatchMergeResponse;
import com.contact.resolution.rest.dto.ContactResponse;
import com.contact.resolution.rest.dto.DuplicatesResponse;
import com.contact.resolution.rest.dto.ErrorResponse;
import com.contact.resolution.rest.dto.FindDuplicatesRequest;
import com.contact.resolution.rest.dto.MergeBatchRequest;
import com.contact.resolution.rest.dto.MergeContactsRequest;
import com.contact.resolution.rest.dto.MergeResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * REST resource for duplicate discovery and contact merging.
 *
 * <p>Failures carry the error kind as {@code code}: validation and invalid merges map to 400,
 * missing contacts to 404, concurrent merges to 409 and migration failures to 500.</p>
 */
@Path("/api/v1/contacts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Contact Resolution", description = "Find and merge duplicate contacts")
public class ContactResolutionResource {
    private static final Logger log = LoggerFactory.getLogger(ContactResolutionResource.class);
    private static final String BASE_PATH = "/api/v1/contacts";
    private static final String INTERNAL_ERROR = "An internal error occurred. Check server logs for details.";

    private final ContactResolver resolver;

    @Inject
    public ContactResolutionResource(ContactResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * POST /api/v1/contacts/duplicates
     */
    @POST
    @Path("/duplicates")
    @Operation(summary = "Find duplicate contacts",
            description = "Ranks existing contacts that likely represent the same person as the given identity.")
    @APIResponse(responseCode = "200", description = "Candidates found (possibly none)")
    @APIResponse(responseCode = "400", description = "No name, email or phone given")
    public Response findDuplicates(FindDuplicatesRequest request) {
        String path = BASE_PATH + "/duplicates";
        if (request == null) {
            return error(ErrorResponse.badRequest("Request body is required", path));
        }
        try {
            List<DuplicateCandidate> candidates = resolver.findDuplicates(
                    request.toIdentityTuple(), request.excludeContactId());
            return Response.ok(DuplicatesResponse.from(candidates)).build();
        } catch (ContactResolutionException e) {
            return error(ErrorResponse.of(e.getKind(), e.getMessage(), path));
        } catch (Exception e) {
            log.error("findDuplicates.failed error={}", e.getMessage(), e);
            return error(ErrorResponse.internalError(INTERNAL_ERROR, path));
        }
    }

    /**
     * POST /api/v1/contacts/merge
     */
    @POST
    @Path("/merge")
    @Operation(summary = "Merge two contacts",
            description = "Merges the secondary contact into the primary and deletes the secondary.")
    @APIResponse(responseCode = "200", description = "Merge completed")
    @APIResponse(responseCode = "400", description = "Invalid request or self-merge")
    @APIResponse(responseCode = "404", description = "Primary or secondary contact not found")
    @APIResponse(responseCode = "409", description = "Concurrent merge of the same contact")
    public Response merge(MergeContactsRequest request) {
        String path = BASE_PATH + "/merge";
        if (request == null) {
            return error(ErrorResponse.badRequest("Request body is required", path));
        }
        try {
            MergeResult result = resolver.mergeContacts(
                    request.primaryContactId(), request.secondaryContactId(), request.toMergeStrategy());
            return Response.ok(MergeResponse.from(result)).build();
        } catch (ContactResolutionException e) {
            return error(ErrorResponse.of(e.getKind(), e.getMessage(), path));
        } catch (IllegalArgumentException e) {
            return error(ErrorResponse.badRequest(e.getMessage(), path));
        } catch (Exception e) {
            log.error("merge.requestFailed primaryId={} secondaryId={} error={}",
                    request.primaryContactId(), request.secondaryContactId(), e.getMessage(), e);
            return error(ErrorResponse.internalError(INTERNAL_ERROR, path));
        }
    }

    /**
     * PUT /api/v1/contacts/duplicates
     *
     * <p>Merges stop at the first failure. Merges already completed stay committed and the
     * response reports them alongside the failure.</p>
     */
    @PUT
    @Path("/duplicates")
    @Operation(summary = "Merge duplicates into a primary contact",
            description = "Merges each duplicate into the primary in order, stopping at the first failure.")
    @APIResponse(responseCode = "200", description = "Batch processed; check success for a partial result")
    @APIResponse(responseCode = "400", description = "Invalid request")
    public Response mergeBatch(MergeBatchRequest request) {
        String path = BASE_PATH + "/duplicates";
        if (request == null) {
            return error(ErrorResponse.badRequest("Request body is required", path));
        }
        try {
            BatchMergeResult result = resolver.mergeBatch(request.primaryId(), request.duplicateIds());
            return Response.ok(BatchMergeResponse.from(result, path)).build();
        } catch (ContactResolutionException e) {
            return error(ErrorResponse.of(e.getKind(), e.getMessage(), path));
        } catch (Exception e) {
            log.error("mergeBatch.requestFailed primaryId={} error={}", request.primaryId(), e.getMessage(), e);
            return error(ErrorResponse.internalError(INTERNAL_ERROR, path));
        }
    }

    /**
     * GET /api/v1/contacts/{id}
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Get contact by ID", description = "Returns the contact with its record counts.")
    @APIResponse(responseCode = "200", description = "Contact found")
    @APIResponse(responseCode = "404", description = "Contact not found")
    public Response getContact(@Parameter(description = "Contact id") @PathParam("id") String contactId) {
        String path = BASE_PATH + "/" + contactId;
        try {
            Optional<Contact> contact = resolver.getContact(contactId);
            if (contact.isEmpty()) {
                return error(ErrorResponse.notFound("Contact not found: " + contactId, path));
            }
            return Response.ok(ContactResponse.from(contact.get(),
                    resolver.getStore().countRelationships(contactId))).build();
        } catch (Exception e) {
            log.error("getContact.failed id={} error={}", contactId, e.getMessage(), e);
            return error(ErrorResponse.internalError(INTERNAL_ERROR, path));
        }
    }

    private static Response error(ErrorResponse body) {
        return Response.status(body.status()).entity(body).build();
    }
}
