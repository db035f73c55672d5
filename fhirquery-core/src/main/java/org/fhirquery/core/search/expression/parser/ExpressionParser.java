package org.fhirquery.core.search.expression.parser;

import org.fhirquery.core.exception.BadRequestException;
import org.fhirquery.core.exception.ResourceNotSupportedException;
import org.fhirquery.core.exception.SearchParameterNotSupportedException;
import org.fhirquery.core.search.expression.Expression;
import org.fhirquery.core.search.expression.IncludeExpression;

/**
 * Turns individual query parameters into expression nodes.
 */
public interface ExpressionParser {

    /**
     * Parses one {@code key=value} search parameter.
     *
     * @param resourceType the resource type the parameter is resolved against
     * @param key          the parameter name, optionally with a {@code :modifier}
     * @param value        the raw value, possibly a comma-separated list
     * @throws SearchParameterNotSupportedException if the parameter is unknown for the resource type
     * @throws BadRequestException                  if the value or modifier is invalid
     */
    Expression parse(String resourceType, String key, String value);

    /**
     * Parses the value of an {@code _include} or {@code _revinclude} parameter,
     * in the form {@code *}, {@code Source:param} or {@code Source:param:Target}.
     *
     * @throws ResourceNotSupportedException if the source type is unknown
     * @throws BadRequestException           if the value is malformed or the parameter is not a usable reference
     */
    IncludeExpression parseInclude(String resourceType, String value, boolean reversed, boolean iterate);
}
