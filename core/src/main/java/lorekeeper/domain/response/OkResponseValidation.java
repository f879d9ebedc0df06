package lorekeeper.domain.response;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;
import lorekeeper.domain.exceptions.InvalidResponse;
import lorekeeper.domain.exceptions.MissingResponse;

@ApplicationScoped
public class OkResponseValidation implements ResponseValidation {
    @Override
    public Response validate(final Response response, final String target) {
        if (response.getStatus() == 404) {
            throw new MissingResponse("Expected status code 200, but got 404 from " + target);
        }

        if (response.getStatus() != 200) {
            throw new InvalidResponse(
                    "Expected status code 200, but got " + response.getStatus() + " from " + target,
                    Try.of(() -> response.readEntity(String.class)).getOrElse(""),
                    response.getStatus());
        }

        return response;
    }
}
