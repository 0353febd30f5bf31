package org.plenum.util;

import io.quarkus.runtime.LaunchMode;
import jakarta.json.Json;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;
import lombok.extern.slf4j.Slf4j;

/**
 * Puts the PLENUM error into the "extensions" of every GraphQL error, under the key "plenumException".
 * Registered as a ServiceLoader in META-INF/services/io.smallrye.graphql.api.ErrorExtensionProvider
 *
 * Clients switch on plenumErrorName. The numeric code and the HTTP status that the REST API
 * would have answered with are added for convenience.
 */
@Slf4j
public class PlenumErrorExtensionProvider implements io.smallrye.graphql.api.ErrorExtensionProvider {

	public static final String KEY = "plenumException";

	/** PlenumExceptions are sometimes wrapped, e.g. by a transaction. Do not look deeper than this. */
	private static final int MAX_CAUSE_DEPTH = 5;

	@Override
	public String getKey() {
		return KEY;
	}

	@Override
	public JsonValue mapValueFrom(Throwable throwable) {
		PlenumException pe = findPlenumException(throwable);
		if (pe != null) {
			return plenumError(pe.getErrorName(), pe.getErrorCodeAsInt(), pe.getHttpResponseStatus().getStatusCode(), pe.getMessage()).build();
		}

		log.warn("Unexpected exception in GraphQL request: " + throwable);
		PlenumException.Errors internal = PlenumException.Errors.INTERNAL_ERROR;
		JsonObjectBuilder json = plenumError(internal.name(), internal.getPlenumErrorCode(), internal.getHttpResponseStatus().getStatusCode(),
				"Internal error while processing your request.");
		if (LaunchMode.current().isDevOrTest()) {
			json.add("throwableException", throwable.getClass().getName());
			json.add("throwableMessage", String.valueOf(throwable.getMessage()));
		}
		return json.build();
	}

	static PlenumException findPlenumException(Throwable throwable) {
		Throwable t = throwable;
		for (int depth = 0; t != null && depth < MAX_CAUSE_DEPTH; depth++) {
			if (t instanceof PlenumException pe) return pe;
			t = t.getCause();
		}
		return null;
	}

	private static JsonObjectBuilder plenumError(String name, int code, int httpStatus, String message) {
		return Json.createObjectBuilder()
				.add("plenumErrorName", name)
				.add("plenumErrorCode", code)
				.add("plenumHttpStatus", httpStatus)
				.add("plenumErrorMessage", message == null ? "" : message);
	}
}
