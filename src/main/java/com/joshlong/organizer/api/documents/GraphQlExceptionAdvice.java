package com.joshlong.organizer.api.documents;

import graphql.GraphQLError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.GraphQlExceptionHandler;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.web.bind.annotation.ControllerAdvice;

import java.util.Map;

@ControllerAdvice
class GraphQlExceptionAdvice {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@GraphQlExceptionHandler
	GraphQLError handleInvalidArgument(IllegalArgumentException ex) {
		this.log.warn("rejected an invalid request: {}", ex.getMessage());
		return GraphQLError.newError() //
			.errorType(ErrorType.BAD_REQUEST) //
			.message(ex.getMessage()) //
			.extensions(Map.of("code", "INVALID_ARGUMENT")) //
			.build();
	}

}
