package org.fhirquery.core.search.expression.parser;

import org.fhirquery.core.exception.BadRequestException;
import org.fhirquery.core.exception.ResourceNotSupportedException;
import org.fhirquery.core.exception.SearchParameterNotSupportedException;
import org.fhirquery.core.resource.ResourceTypeRegistry;
import org.fhirquery.core.search.expression.BinaryOperator;
import org.fhirquery.core.search.expression.Expression;
import org.fhirquery.core.search.expression.FieldName;
import org.fhirquery.core.search.expression.IncludeExpression;
import org.fhirquery.core.search.expression.StringOperator;
import org.fhirquery.core.searchparam.SearchParameterDefinitionManager;
import org.fhirquery.core.searchparam.SearchParameterInfo;
import org.hl7.fhir.r5.model.Enumerations.SearchParamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses search parameters into expressions using the registered parameter definitions.
 * <p>
 * Supported value syntax per parameter type:
 * - String: plain (starts-with, case-insensitive), :exact, :contains
 * - Token: system|code, |code, system|, code
 * - Reference: [type]/[id], absolute URL, [id], with an optional :[type] modifier
 * - Date: partial dates and dateTimes with comparison prefixes
 * - Number: with comparison prefixes
 * - Quantity: [prefix]value|system|code
 * - Uri: exact match
 * Any type accepts :missing=true|false. Comma separated values are OR-ed.
 * </p>
 */
@Component
public class DefaultExpressionParser implements ExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(DefaultExpressionParser.class);

    // Pattern to extract prefix from value: (prefix)(value)
    private static final Pattern PREFIX_PATTERN = Pattern.compile("^(eq|ne|lt|gt|le|ge|sa|eb|ap)(.+)$");

    // Version suffix of a versioned reference; search matches the resource, not the version
    private static final Pattern HISTORY_SUFFIX_PATTERN = Pattern.compile("/_history/[^/]+$");

    private static final String MISSING_MODIFIER = "missing";
    private static final String WILDCARD = "*";

    private final SearchParameterDefinitionManager definitionManager;
    private final ResourceTypeRegistry resourceTypeRegistry;

    public DefaultExpressionParser(SearchParameterDefinitionManager definitionManager,
                                   ResourceTypeRegistry resourceTypeRegistry) {
        this.definitionManager = definitionManager;
        this.resourceTypeRegistry = resourceTypeRegistry;
    }

    @Override
    public Expression parse(String resourceType, String key, String value) {
        if (key.startsWith("_has:") || key.contains(".")) {
            // Chained and reverse-chained parameters are not supported
            throw new SearchParameterNotSupportedException(resourceType, key);
        }

        int colonIndex = key.indexOf(':');
        String name = colonIndex > 0 ? key.substring(0, colonIndex) : key;
        String modifier = colonIndex > 0 ? key.substring(colonIndex + 1) : null;

        SearchParameterInfo parameter = definitionManager.getSearchParameter(resourceType, name);

        if (MISSING_MODIFIER.equals(modifier)) {
            return Expression.missingSearchParameter(parameter, parseBoolean(key, value));
        }

        List<Expression> alternatives = new ArrayList<>();
        for (String item : splitValues(value)) {
            if (item.isEmpty()) {
                throw new BadRequestException(String.format(
                        "The search parameter '%s' contains an empty value: '%s'", key, value));
            }
            alternatives.add(parseValue(parameter, modifier, item));
        }

        log.trace("Parsed {}={} for {} into {} alternative(s)", key, value, resourceType, alternatives.size());

        return Expression.searchParameter(parameter, Expression.orIfNeeded(alternatives));
    }

    private Expression parseValue(SearchParameterInfo parameter, String modifier, String value) {
        SearchParamType type = parameter.getType();
        if (type == null) {
            throw new SearchParameterNotSupportedException(
                    String.format("Search parameter '%s' has no type", parameter.getCode()));
        }

        return switch (type) {
            case STRING -> parseString(parameter, modifier, value);
            case TOKEN -> parseToken(parameter, modifier, value);
            case REFERENCE -> parseReference(parameter, modifier, value);
            case DATE -> parseDate(parameter, modifier, value);
            case NUMBER -> parseNumber(parameter, modifier, value);
            case QUANTITY -> parseQuantity(parameter, modifier, value);
            case URI -> parseUri(parameter, modifier, value);
            default -> throw new SearchParameterNotSupportedException(String.format(
                    "Search parameter '%s' of type '%s' is not supported", parameter.getCode(), type.toCode()));
        };
    }

    // ==================== String ====================

    private Expression parseString(SearchParameterInfo parameter, String modifier, String value) {
        if (modifier == null) {
            return Expression.string(StringOperator.STARTS_WITH, FieldName.STRING, null, value, true);
        }
        return switch (modifier) {
            case "exact" -> Expression.stringEquals(FieldName.STRING, null, value, false);
            case "contains" -> Expression.string(StringOperator.CONTAINS, FieldName.STRING, null, value, true);
            default -> throw unsupportedModifier(parameter, modifier);
        };
    }

    // ==================== Token ====================

    private Expression parseToken(SearchParameterInfo parameter, String modifier, String value) {
        if (modifier != null) {
            throw unsupportedModifier(parameter, modifier);
        }

        // Handle escaped pipe
        String processedValue = value.replace("\\|", "\u0000");
        int pipeIndex = processedValue.indexOf('|');

        if (pipeIndex < 0) {
            return Expression.stringEquals(FieldName.TOKEN_CODE, null, restorePipes(processedValue), false);
        }

        String system = restorePipes(processedValue.substring(0, pipeIndex));
        String code = restorePipes(processedValue.substring(pipeIndex + 1));

        if (system.isEmpty() && code.isEmpty()) {
            throw new BadRequestException(String.format(
                    "The token value '%s' for search parameter '%s' must have a system or a code",
                    value, parameter.getCode()));
        }
        if (system.isEmpty()) {
            // |code: the code must have no system
            return Expression.and(
                    Expression.missingField(FieldName.TOKEN_SYSTEM, null),
                    Expression.stringEquals(FieldName.TOKEN_CODE, null, code, false));
        }
        if (code.isEmpty()) {
            return Expression.stringEquals(FieldName.TOKEN_SYSTEM, null, system, false);
        }
        return Expression.and(
                Expression.stringEquals(FieldName.TOKEN_SYSTEM, null, system, false),
                Expression.stringEquals(FieldName.TOKEN_CODE, null, code, false));
    }

    private static String restorePipes(String value) {
        return value.replace("\u0000", "|");
    }

    // ==================== Reference ====================

    private Expression parseReference(SearchParameterInfo parameter, String modifier, String value) {
        String typeModifier = null;
        if (modifier != null) {
            if (!parameter.getTargetResourceTypes().contains(modifier)) {
                throw unsupportedModifier(parameter, modifier);
            }
            typeModifier = modifier;
        }

        String baseUri = null;
        String type;
        String id;

        value = HISTORY_SUFFIX_PATTERN.matcher(value).replaceFirst("");

        if (value.startsWith("http://") || value.startsWith("https://") || value.startsWith("urn:")) {
            String[] urlParts = value.split("/");
            if (urlParts.length < 2 || urlParts[urlParts.length - 2].isEmpty()
                    || !Character.isUpperCase(urlParts[urlParts.length - 2].charAt(0))) {
                throw new BadRequestException(String.format(
                        "The reference '%s' for search parameter '%s' is not a valid [base]/[type]/[id] URL",
                        value, parameter.getCode()));
            }
            type = urlParts[urlParts.length - 2];
            id = urlParts[urlParts.length - 1];
            baseUri = value.substring(0, value.length() - type.length() - id.length() - 1);
        } else if (value.contains("/")) {
            String[] parts = value.split("/", 2);
            type = parts[0];
            id = parts[1];
        } else {
            type = typeModifier;
            id = value;
        }

        if (type != null && !parameter.getTargetResourceTypes().isEmpty()
                && !parameter.getTargetResourceTypes().contains(type)) {
            throw new BadRequestException(String.format(
                    "Resource type '%s' is not a valid target of search parameter '%s'", type, parameter.getCode()));
        }
        if (typeModifier != null && !typeModifier.equals(type)) {
            throw new BadRequestException(String.format(
                    "The reference '%s' does not match the type modifier ':%s'", value, typeModifier));
        }

        List<Expression> parts = new ArrayList<>();
        if (baseUri != null) {
            parts.add(Expression.stringEquals(FieldName.REFERENCE_BASE_URI, null, baseUri, false));
        }
        if (type != null) {
            parts.add(Expression.stringEquals(FieldName.REFERENCE_RESOURCE_TYPE, null, type, false));
        }
        parts.add(Expression.stringEquals(FieldName.REFERENCE_RESOURCE_ID, null, id, false));

        return Expression.andIfNeeded(parts);
    }

    // ==================== Date ====================

    private Expression parseDate(SearchParameterInfo parameter, String modifier, String value) {
        if (modifier != null) {
            throw unsupportedModifier(parameter, modifier);
        }

        ParsedValue parsed = parseValueWithPrefix(value);
        DateTimeSearchValue range;
        try {
            range = DateTimeSearchValue.parse(parsed.value());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(String.format(
                    "The value '%s' for search parameter '%s' is not a valid date", value, parameter.getCode()), e);
        }

        FieldName start = FieldName.DATE_TIME_START;
        FieldName end = FieldName.DATE_TIME_END;

        return switch (parsed.prefix()) {
            // Approximate matching is treated as equality over the value's precision
            case "eq", "ap" -> Expression.and(
                    Expression.binary(BinaryOperator.GREATER_THAN_OR_EQUAL, start, null, range.start()),
                    Expression.binary(BinaryOperator.LESS_THAN_OR_EQUAL, end, null, range.end()));
            case "ne" -> Expression.or(
                    Expression.binary(BinaryOperator.LESS_THAN, start, null, range.start()),
                    Expression.binary(BinaryOperator.GREATER_THAN, end, null, range.end()));
            case "lt" -> Expression.binary(BinaryOperator.LESS_THAN, start, null, range.start());
            case "gt" -> Expression.binary(BinaryOperator.GREATER_THAN, end, null, range.end());
            case "le" -> Expression.binary(BinaryOperator.LESS_THAN_OR_EQUAL, start, null, range.end());
            case "ge" -> Expression.binary(BinaryOperator.GREATER_THAN_OR_EQUAL, end, null, range.start());
            case "sa" -> Expression.binary(BinaryOperator.GREATER_THAN, start, null, range.end());
            case "eb" -> Expression.binary(BinaryOperator.LESS_THAN, end, null, range.start());
            default -> throw new IllegalStateException("Unexpected prefix: " + parsed.prefix());
        };
    }

    // ==================== Number / Quantity ====================

    private Expression parseNumber(SearchParameterInfo parameter, String modifier, String value) {
        if (modifier != null) {
            throw unsupportedModifier(parameter, modifier);
        }
        ParsedValue parsed = parseValueWithPrefix(value);
        return comparison(parsed.prefix(), FieldName.NUMBER, parseDecimal(parameter, value, parsed.value()));
    }

    private Expression parseQuantity(SearchParameterInfo parameter, String modifier, String value) {
        if (modifier != null) {
            throw unsupportedModifier(parameter, modifier);
        }

        ParsedValue parsed = parseValueWithPrefix(value);

        // Split by pipe: value|system|code
        String[] parts = parsed.value().split("\\|", -1);
        if (parts.length > 3) {
            throw new BadRequestException(String.format(
                    "The quantity '%s' for search parameter '%s' must be [prefix]value|system|code",
                    value, parameter.getCode()));
        }

        List<Expression> expressions = new ArrayList<>();
        expressions.add(comparison(parsed.prefix(), FieldName.QUANTITY, parseDecimal(parameter, value, parts[0])));
        if (parts.length >= 2 && !parts[1].isEmpty()) {
            expressions.add(Expression.stringEquals(FieldName.QUANTITY_SYSTEM, null, parts[1], false));
        }
        if (parts.length >= 3 && !parts[2].isEmpty()) {
            expressions.add(Expression.stringEquals(FieldName.QUANTITY_CODE, null, parts[2], false));
        }
        return Expression.andIfNeeded(expressions);
    }

    private static BigDecimal parseDecimal(SearchParameterInfo parameter, String rawValue, String number) {
        try {
            return new BigDecimal(number);
        } catch (NumberFormatException e) {
            throw new BadRequestException(String.format(
                    "The value '%s' for search parameter '%s' is not a valid number", rawValue, parameter.getCode()), e);
        }
    }

    private static Expression comparison(String prefix, FieldName fieldName, BigDecimal value) {
        BinaryOperator operator = switch (prefix) {
            case "eq", "ap" -> BinaryOperator.EQUAL;
            case "ne" -> BinaryOperator.NOT_EQUAL;
            case "lt", "eb" -> BinaryOperator.LESS_THAN;
            case "gt", "sa" -> BinaryOperator.GREATER_THAN;
            case "le" -> BinaryOperator.LESS_THAN_OR_EQUAL;
            case "ge" -> BinaryOperator.GREATER_THAN_OR_EQUAL;
            default -> throw new IllegalStateException("Unexpected prefix: " + prefix);
        };
        return Expression.binary(operator, fieldName, null, value);
    }

    // ==================== Uri ====================

    private Expression parseUri(SearchParameterInfo parameter, String modifier, String value) {
        if (modifier != null) {
            throw unsupportedModifier(parameter, modifier);
        }
        return Expression.stringEquals(FieldName.URI, null, value, false);
    }

    // ==================== Include ====================

    @Override
    public IncludeExpression parseInclude(String resourceType, String value, boolean reversed, boolean iterate) {
        if (WILDCARD.equals(value)) {
            return new IncludeExpression(resourceType, null, resourceType, null, true, reversed, iterate);
        }

        String[] parts = value.split(":", -1);
        if (parts.length < 2 || parts.length > 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new BadRequestException(String.format(
                    "The include value '%s' must have the form [source type]:[search parameter](:[target type])", value));
        }

        String sourceType = parts[0];
        if (!resourceTypeRegistry.isKnownResourceType(sourceType)) {
            throw new ResourceNotSupportedException(sourceType);
        }

        SearchParameterInfo referenceParameter = definitionManager.findSearchParameter(sourceType, parts[1])
                .orElseThrow(() -> new BadRequestException(String.format(
                        "Search parameter '%s' is not defined for resource type '%s'", parts[1], sourceType)));

        if (!referenceParameter.isReference()) {
            throw new BadRequestException(String.format(
                    "Search parameter '%s' of resource type '%s' is not a reference and cannot be included",
                    parts[1], sourceType));
        }

        String targetType = null;
        if (parts.length == 3) {
            targetType = parts[2];
            if (!referenceParameter.getTargetResourceTypes().contains(targetType)) {
                throw new BadRequestException(String.format(
                        "Resource type '%s' is not a valid target of search parameter '%s'. Valid targets: %s",
                        targetType, referenceParameter.getCode(), referenceParameter.getTargetResourceTypes()));
            }
        }

        return new IncludeExpression(resourceType, referenceParameter, sourceType, targetType, false, reversed, iterate);
    }

    // ==================== Helpers ====================

    private static boolean parseBoolean(String key, String value) {
        if ("true".equals(value)) {
            return true;
        }
        if ("false".equals(value)) {
            return false;
        }
        throw new BadRequestException(String.format(
                "The value of '%s' must be 'true' or 'false', got '%s'", key, value));
    }

    /**
     * Splits on commas that are not escaped with a backslash.
     */
    static List<String> splitValues(String value) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && value.charAt(i + 1) == ',') {
                current.append(',');
                i++;
            } else if (c == ',') {
                result.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        result.add(current.toString());
        return result;
    }

    private static ParsedValue parseValueWithPrefix(String value) {
        Matcher matcher = PREFIX_PATTERN.matcher(value);
        if (matcher.matches()) {
            return new ParsedValue(matcher.group(1), matcher.group(2));
        }
        return new ParsedValue("eq", value);
    }

    private static BadRequestException unsupportedModifier(SearchParameterInfo parameter, String modifier) {
        return new BadRequestException(String.format(
                "Modifier ':%s' is not supported for search parameter '%s'", modifier, parameter.getCode()));
    }

    private record ParsedValue(String prefix, String value) {}
}
