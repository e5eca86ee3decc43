package likelion._th.roadwatch.support;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

// 네트워크 없이 고정 응답을 돌려주는 WebClient
public class StubExchange implements ExchangeFunction {

    private final HttpStatus status;
    private final String body;
    private final List<ClientRequest> requests = new ArrayList<>();

    private StubExchange(HttpStatus status, String body) {
        this.status = status;
        this.body = body;
    }

    public static StubExchange json(String body) {
        return new StubExchange(HttpStatus.OK, body);
    }

    public static StubExchange status(HttpStatus status) {
        return new StubExchange(status, "{}");
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    public WebClient webClient(String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeFunction(this)
                .build();
    }

    public List<ClientRequest> getRequests() {
        return requests;
    }

    public ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
