package ai.attackframework.tools.opensearch.errors;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.opensearch.client.json.JsonData;
import org.opensearch.client.opensearch._types.ErrorResponse;
import org.opensearch.client.opensearch._types.OpenSearchException;

class OpenSearchErrorsTest {

    private static OpenSearchException serverError(String type, int status) {
        return new OpenSearchException(ErrorResponse.of(r -> r
                .error(e -> e.type(type).reason("because"))
                .status(status)));
    }

    @Test
    void wrap_classifiesTypedServerErrors() {
        assertThat(OpenSearchErrors.wrap(serverError("version_conflict_engine_exception", 409), "update"))
                .isInstanceOf(VersionConflictException.class);
        assertThat(OpenSearchErrors.wrap(serverError("security_exception", 403), "search"))
                .isInstanceOf(AuthenticationException.class);
        assertThat(OpenSearchErrors.wrap(serverError("resource_already_exists_exception", 400), "create"))
                .isInstanceOf(ResourceExistsException.class);
        assertThat(OpenSearchErrors.wrap(serverError("search_phase_execution_exception", 400), "search"))
                .isInstanceOf(SearchQueryException.class);
        assertThat(OpenSearchErrors.wrap(serverError("illegal_argument_exception", 400), "x"))
                .isExactlyInstanceOf(OpenSearchOperationException.class);
    }

    @Test
    void wrap_indexNotFound_carriesIndexFromMetadata() {
        OpenSearchException error = new OpenSearchException(ErrorResponse.of(r -> r
                .error(e -> e.type("index_not_found_exception").reason("no such index")
                        .metadata("index", JsonData.of("products")))
                .status(404)));

        OpenSearchOperationException wrapped = OpenSearchErrors.wrap(error, "search");

        assertThat(wrapped).isInstanceOf(IndexNotFoundException.class);
        assertThat(((IndexNotFoundException) wrapped).indexName()).isEqualTo("products");
        assertThat(wrapped.originalError()).isSameAs(error);
    }

    @Test
    void wrap_classifiesTransportFailuresByMessage() {
        assertThat(OpenSearchErrors.wrap(new SocketTimeoutException("Read timed out"), "search"))
                .isInstanceOf(OperationTimeoutException.class);
        assertThat(OpenSearchErrors.wrap(new IOException("io", new ConnectException("Connection refused")), "ping"))
                .isInstanceOf(ConnectionFailedException.class);
        assertThat(OpenSearchErrors.wrap(new IllegalStateException("weird"), "op"))
                .isExactlyInstanceOf(OpenSearchOperationException.class)
                .hasMessageStartingWith("op: weird");
    }

    @Test
    void wrap_returnsLibraryExceptionsUnchanged() {
        ValidationException v = new ValidationException("bad");

        assertThat(OpenSearchErrors.wrap(v, "ctx")).isSameAs(v);
    }

    @Test
    void statusAndType_followCauseChain() {
        RuntimeException outer = new RuntimeException("outer", serverError("x_exception", 418));

        assertThat(OpenSearchErrors.status(outer)).isEqualTo(418);
        assertThat(OpenSearchErrors.errorType(outer)).isEqualTo("x_exception");
        assertThat(OpenSearchErrors.status(new IOException("plain"))).isEqualTo(-1);
        assertThat(OpenSearchErrors.errorType(new IOException("plain"))).isNull();
    }

    @Test
    void isNotFound_recognizesTypedAndLibraryErrors() {
        assertThat(OpenSearchErrors.isNotFound(serverError("index_not_found_exception", 404))).isTrue();
        assertThat(OpenSearchErrors.isNotFound(new DocumentNotFoundException("i", "1", null))).isTrue();
        assertThat(OpenSearchErrors.isNotFound(serverError("illegal_argument_exception", 400))).isFalse();
    }

    @Test
    void message_appendsOriginalError() {
        OpenSearchOperationException e = new OpenSearchOperationException("failed", new IOException("disk"));

        assertThat(e.baseMessage()).isEqualTo("failed");
        assertThat(e.getMessage()).isEqualTo("failed (Original: java.io.IOException: disk)");
        assertThat(new OpenSearchOperationException("plain").getMessage()).isEqualTo("plain");
    }

    @Test
    void subclassMessages_describeTheResource() {
        assertThat(new DocumentNotFoundException("products", "42", null).getMessage())
                .isEqualTo("Document '42' not found in index 'products'");
        assertThat(new ResourceExistsException("Index", "products", null).getMessage())
                .isEqualTo("Index 'products' already exists");
        assertThat(new MappingException("wrong type", "price", null).field()).isEqualTo("price");

        BulkOperationException bulk = new BulkOperationException("partial",
                List.of(Map.of("id", "1"), Map.of("id", "2")), null);
        assertThat(bulk.getMessage()).isEqualTo("Bulk operation error: Bulk operation failed with 2 errors: partial");
        assertThat(bulk.errors()).hasSize(2);
    }
}
