package org.fhirquery.core.search.expression;

/**
 * Visitor over the closed set of {@link Expression} variants.
 *
 * @param <C> the context passed through the traversal
 * @param <R> the result of visiting a node
 */
public interface ExpressionVisitor<C, R> {

    R visitSearchParameter(SearchParameterExpression expression, C context);

    R visitString(StringExpression expression, C context);

    R visitBinary(BinaryExpression expression, C context);

    R visitMissingField(MissingFieldExpression expression, C context);

    R visitMissingSearchParameter(MissingSearchParameterExpression expression, C context);

    R visitMultiary(MultiaryExpression expression, C context);

    R visitCompartment(CompartmentSearchExpression expression, C context);

    R visitInclude(IncludeExpression expression, C context);
}
