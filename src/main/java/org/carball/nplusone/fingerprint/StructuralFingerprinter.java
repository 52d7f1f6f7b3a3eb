package org.carball.nplusone.fingerprint;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.ArrayConstructor;
import net.sf.jsqlparser.expression.DateTimeLiteralExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.HexValue;
import net.sf.jsqlparser.expression.IntervalExpression;
import net.sf.jsqlparser.expression.JdbcNamedParameter;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.util.deparser.ExpressionDeParser;
import net.sf.jsqlparser.util.deparser.SelectDeParser;
import net.sf.jsqlparser.util.deparser.StatementDeParser;

import java.util.regex.Pattern;

/**
 * Parses the query with JSqlParser and digests its canonical rendering, in which every
 * literal and bind parameter is {@code ?}, constant {@code IN} lists are {@code (?+)} and
 * constant {@code ARRAY[...]} constructors are {@code ARRAY[?+]}.
 * Whitespace, keyword case, literal values and IN-list length therefore do not affect
 * the result; predicates, joined tables and selected columns do.
 */
@Slf4j
public class StructuralFingerprinter implements Fingerprinter {

    // PostgreSQL positional binds ($1, $2, ...) are not understood by JSqlParser
    private static final Pattern POSITIONAL_PARAMETER = Pattern.compile("\\$\\d+");
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*\\z");

    @Override
    public String fingerprint(String sql) {
        return Digests.sha256Hex(canonicalize(sql));
    }

    /**
     * Canonical text the fingerprint is computed from.
     */
    public String canonicalize(String sql) {
        if (sql == null) {
            throw new NormalizationException("Cannot fingerprint a null query", null);
        }

        String prepared = preprocess(sql);
        try {
            Statement statement = CCJSqlParserUtil.parse(prepared);
            return render(statement);
        } catch (JSQLParserException e) {
            log.debug("Unable to parse query for fingerprinting: {}", e.getMessage());
            throw new NormalizationException("Unable to parse query: " + e.getMessage(), sql, e);
        }
    }

    private static String preprocess(String sql) {
        String processed = POSITIONAL_PARAMETER.matcher(sql.trim()).replaceAll("?");
        return TRAILING_SEMICOLON.matcher(processed).replaceAll("");
    }

    private static String render(Statement statement) {
        StringBuilder buffer = new StringBuilder();
        ExpressionDeParser expressionDeParser = new LiteralMaskingDeParser();
        SelectDeParser selectDeParser = new SelectDeParser(expressionDeParser, buffer);
        expressionDeParser.setSelectVisitor(selectDeParser);
        expressionDeParser.setBuffer(buffer);
        StatementDeParser statementDeParser = new StatementDeParser(expressionDeParser, selectDeParser, buffer);
        statement.accept(statementDeParser);
        return buffer.toString();
    }

    private static boolean isConstant(Expression expression) {
        if (expression instanceof SignedExpression signed) {
            return isConstant(signed.getExpression());
        }
        return expression instanceof LongValue
                || isBooleanLiteral(expression)
                || expression instanceof DateTimeLiteralExpression
                || expression instanceof IntervalExpression
                || expression instanceof DoubleValue
                || expression instanceof StringValue
                || expression instanceof HexValue
                || expression instanceof NullValue
                || expression instanceof JdbcParameter
                || expression instanceof JdbcNamedParameter;
    }

    /**
     * JSqlParser reads unquoted {@code TRUE} and {@code FALSE} as column references.
     */
    private static boolean isBooleanLiteral(Expression expression) {
        if (!(expression instanceof Column column)) {
            return false;
        }
        if (column.getTable() != null && column.getTable().getName() != null) {
            return false;
        }
        String name = column.getColumnName();
        return "true".equalsIgnoreCase(name) || "false".equalsIgnoreCase(name);
    }

    private static final class LiteralMaskingDeParser extends ExpressionDeParser {

        private static final String PLACEHOLDER = "?";

        @Override
        public void visit(LongValue longValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(DoubleValue doubleValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(StringValue stringValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(HexValue hexValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(NullValue nullValue) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(JdbcParameter jdbcParameter) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(JdbcNamedParameter jdbcNamedParameter) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(DateTimeLiteralExpression literal) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(IntervalExpression interval) {
            getBuffer().append(PLACEHOLDER);
        }

        @Override
        public void visit(Column column) {
            if (isBooleanLiteral(column)) {
                getBuffer().append(PLACEHOLDER);
            } else {
                super.visit(column);
            }
        }

        @Override
        public void visit(ArrayConstructor array) {
            if (array.getExpressions() == null || !allConstant(array.getExpressions())) {
                super.visit(array);
                return;
            }

            getBuffer().append(array.isArrayKeyword() ? "ARRAY[?+]" : "[?+]");
        }

        @Override
        public void visit(SignedExpression signedExpression) {
            if (isConstant(signedExpression.getExpression())) {
                getBuffer().append(PLACEHOLDER);
            } else {
                super.visit(signedExpression);
            }
        }

        @Override
        public void visit(InExpression inExpression) {
            if (!(inExpression.getRightExpression() instanceof ExpressionList<?> values) || !allConstant(values)) {
                super.visit(inExpression);
                return;
            }

            inExpression.getLeftExpression().accept(this);
            if (inExpression.isNot()) {
                getBuffer().append(" NOT");
            }
            getBuffer().append(" IN (?+)");
        }

        private static boolean allConstant(ExpressionList<?> values) {
            for (Expression value : values) {
                if (!isConstant(value)) {
                    return false;
                }
            }
            return true;
        }
    }
}
