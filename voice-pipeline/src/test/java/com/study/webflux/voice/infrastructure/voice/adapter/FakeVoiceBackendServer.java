package com.study.webflux.voice.infrastructure.voice.adapter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;

import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import static org.springframework.web.reactive.function.server.RequestPredicates.POST;

/** 합성/전사 백엔드를 흉내 내는 테스트용 HTTP 서버입니다. 임의 포트로 기동합니다. */
public class FakeVoiceBackendServer {

	private final AtomicInteger requestCount = new AtomicInteger();
	private final AtomicReference<ServerRequest> lastRequest = new AtomicReference<>();
	private final AtomicReference<String> lastBody = new AtomicReference<>();
	private volatile ServerBehavior behavior = ServerBehavior.json("{}");
	private DisposableServer server;

	public FakeVoiceBackendServer start(String path) {
		RouterFunction<ServerResponse> routes = RouterFunctions.route(POST(path), this::handle);
		HttpHandler httpHandler = RouterFunctions.toHttpHandler(routes);
		server = HttpServer.create().port(0).handle(new ReactorHttpHandlerAdapter(httpHandler))
			.bindNow();
		return this;
	}

	public void stop() {
		if (server != null) {
			server.disposeNow();
		}
	}

	public String baseUrl() {
		return "http://localhost:" + server.port();
	}

	public void setBehavior(ServerBehavior behavior) {
		this.behavior = behavior;
	}

	public int getRequestCount() {
		return requestCount.get();
	}

	public ServerRequest getLastRequest() {
		return lastRequest.get();
	}

	public String getLastBody() {
		return lastBody.get();
	}

	private Mono<ServerResponse> handle(ServerRequest request) {
		requestCount.incrementAndGet();
		lastRequest.set(request);
		ServerBehavior current = behavior;
		return request.bodyToMono(String.class)
			.defaultIfEmpty("")
			.doOnNext(lastBody::set)
			.then(ServerResponse.status(current.status())
				.contentType(current.contentType())
				.bodyValue(current.body()));
	}

	public record ServerBehavior(
		HttpStatus status,
		MediaType contentType,
		Object body) {

		public static ServerBehavior audio(byte[] audio) {
			return new ServerBehavior(HttpStatus.OK, MediaType.parseMediaType("audio/mpeg"), audio);
		}

		public static ServerBehavior json(String json) {
			return new ServerBehavior(HttpStatus.OK, MediaType.APPLICATION_JSON, json);
		}

		public static ServerBehavior error(HttpStatus status) {
			return new ServerBehavior(status, MediaType.APPLICATION_JSON,
				"{\"detail\":\"" + status.getReasonPhrase() + "\"}");
		}
	}
}
