package org.plenum.util;

import com.google.common.base.Strings;
import io.quarkus.vertx.web.RouteFilter;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Log one line per HTTP request and one per response, tagged with a running request number.
 *
 * Only method and path are logged. Query strings, headers and bodies never are:
 * vote mutations carry the voter's ranking and verification requests carry a receipt secret.
 */
@Slf4j
public class PlenumRequestLogger {

	private static final long MAX_REQUEST_NUMBER = 999999;

	private final AtomicLong requestCounter = new AtomicLong(0);

	@RouteFilter(100)
	void logRequest(RoutingContext ctx) {
		String tag = nextTag();
		HttpServerRequest request = ctx.request();
		long startedAt = System.currentTimeMillis();

		request.exceptionHandler(err -> log.error("=> [" + tag + "] Request failed: " + err.getMessage()));
		ctx.response().exceptionHandler(err -> log.error("<= [" + tag + "] Response failed: " + err.getMessage()));
		log.debug("=> [" + tag + "] " + request.method() + " " + request.path());

		ctx.addEndHandler(res -> {
			String etag = ctx.response().headers().get("ETag");
			log.debug("<= [" + tag + "] " + ctx.response().getStatusCode() + " in " + (System.currentTimeMillis() - startedAt) + "ms" +
					(etag == null ? "" : " ETag=" + etag));
		});
		ctx.next();
	}

	private String nextTag() {
		long number = requestCounter.updateAndGet(n -> n >= MAX_REQUEST_NUMBER ? 1 : n + 1);
		return Strings.padStart(String.valueOf(number), 6, ' ');
	}
}
