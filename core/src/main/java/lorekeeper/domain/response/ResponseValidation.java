package lorekeeper.domain.response;

import jakarta.ws.rs.core.Response;

public interface ResponseValidation {
    /**
     * Returns the response if it can be used, or throws an ExternalException describing why not.
     */
    Response validate(Response response, String target);
}
