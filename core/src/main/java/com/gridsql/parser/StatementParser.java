package com.gridsql.parser;

import com.gridsql.exception.SQLParseException;
import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.BinaryExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.expression.FunctionCall;
import com.gridsql.expression.Literal;
import com.gridsql.expression.StarExpression;
import com.gridsql.expression.UnaryExpression;
import com.gridsql.statement.Assignment;
import com.gridsql.statement.DeleteStatement;
import com.gridsql.statement.DisplayOption;
import com.gridsql.statement.InsertStatement;
import com.gridsql.statement.JoinClause;
import com.gridsql.statement.OrderItem;
import com.gridsql.statement.Projection;
import com.gridsql.statement.RangeRef;
import com.gridsql.statement.SelectStatement;
import com.gridsql.statement.Statement;
import com.gridsql.statement.TableReference;
import com.gridsql.statement.UpdateStatement;
import com.gridsql.statement.VirtualTableRef;
import com.gridsql.types.BooleanValue;
import com.gridsql.types.DateValue;
import com.gridsql.types.NullValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;
import com.gridsql.types.TypeCoercion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser producing one {@link Statement} per input.
 *
 * <p>Keywords are case-insensitive. After the verb and its mandatory part (the SELECT
 * list, the SET list, the VALUES tuples) the optional clauses may appear in any order,
 * each at most once.
 *
 * <p>Expression precedence, lowest first:
 * <pre>
 *   OR
 *   AND
 *   NOT
 *   = != &lt; &lt;= &gt; &gt;=  contains  starts with  ends with  like  matches  is [not] null
 *   + -
 *   * /
 *   unary -
 *   literal, column, function, aggregate, ( expr )
 * </pre>
 *
 * <p>Example usage:
 * <pre>
 *   Statement stmt = StatementParser.parse(
 *       "SELECT Region, SUM(Amount) FROM :sales WHERE Amount &gt; 50 GROUP BY Region");
 * </pre>
 *
 * <p>Any failure raises {@link SQLParseException} naming the clause being parsed; no
 * partial statement is ever returned.
 */
public final class StatementParser {

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
        "SELECT", "INSERT", "UPDATE", "DELETE", "FROM", "WHERE", "GROUP", "BY", "HAVING",
        "ORDER", "LIMIT", "OFFSET", "LABEL", "FORMAT", "PIVOT", "JOIN", "LEFT", "RIGHT",
        "INNER", "OUTER", "ON", "AS", "AND", "OR", "NOT", "SET", "VALUES", "INTO",
        "DISTINCT", "ASC", "DESC", "IS", "NULL", "TRUE", "FALSE", "CONTAINS", "LIKE",
        "MATCHES"));

    private final List<Token> tokens;
    private int index;
    private String clause = "statement";

    private StatementParser(String statement) {
        this.tokens = new Lexer(statement).tokenize();
    }

    /**
     * Parses a single statement.
     *
     * @param statement the raw statement text
     * @return the statement
     * @throws SQLParseException if the statement does not parse
     */
    public static Statement parse(String statement) {
        if (statement == null || statement.isBlank()) {
            throw new SQLParseException("statement", 0, "", "statement is empty");
        }
        return new StatementParser(statement).parseStatement();
    }

    private Statement parseStatement() {
        Token verb = peek();
        Statement result;
        if (verb.isKeyword("SELECT")) {
            result = parseSelect();
        } else if (verb.isKeyword("INSERT")) {
            result = parseInsert();
        } else if (verb.isKeyword("UPDATE")) {
            result = parseUpdate();
        } else if (verb.isKeyword("DELETE")) {
            result = parseDelete();
        } else {
            throw error("expected SELECT, INSERT, UPDATE or DELETE");
        }
        if (peek().is(TokenType.SEMICOLON)) {
            advance();
        }
        if (!peek().is(TokenType.EOF)) {
            throw error("unexpected input after statement");
        }
        return result;
    }

    // ==================== SELECT ====================

    private Statement parseSelect() {
        clause = "SELECT";
        advance();
        SelectStatement.Builder b = SelectStatement.builder();
        if (acceptKeyword("DISTINCT")) {
            b.distinct(true);
            if (acceptKeyword("ON")) {
                expect(TokenType.LPAREN, "'(' after DISTINCT ON");
                b.distinctOn(parseExpressionList());
                expect(TokenType.RPAREN, "')'");
            }
        }
        do {
            b.projection(parseProjection());
        } while (accept(TokenType.COMMA));

        Set<String> seen = new HashSet<>();
        boolean hasFrom = false;
        while (!atStatementEnd()) {
            Token t = peek();
            if (isJoinStart()) {
                if (!hasFrom) {
                    throw error("JOIN requires a FROM clause");
                }
                clause = "JOIN";
                b.join(parseJoin());
                continue;
            }
            String keyword = clauseKeyword(t);
            if (!seen.add(keyword)) {
                throw error("duplicate " + keyword + " clause");
            }
            clause = keyword;
            switch (keyword) {
                case "FROM" -> {
                    advance();
                    b.from(parseTableReference());
                    hasFrom = true;
                }
                case "WHERE" -> {
                    advance();
                    b.where(parseExpression());
                }
                case "GROUP BY" -> {
                    advance();
                    expectKeyword("BY");
                    b.groupBy(parseExpressionList());
                }
                case "PIVOT" -> {
                    advance();
                    b.pivot(parseExpressionList());
                }
                case "HAVING" -> {
                    advance();
                    b.having(parseExpression());
                }
                case "ORDER BY" -> {
                    advance();
                    expectKeyword("BY");
                    b.orderBy(parseOrderList());
                }
                case "LIMIT" -> {
                    advance();
                    b.limit(parseNonNegativeInt());
                }
                case "OFFSET" -> {
                    advance();
                    b.offset(parseNonNegativeInt());
                }
                case "LABEL" -> {
                    advance();
                    b.labels(parseDisplayOptions());
                }
                case "FORMAT" -> {
                    advance();
                    b.formats(parseDisplayOptions());
                }
                default -> throw error("unexpected " + keyword + " in SELECT");
            }
        }
        return b.build();
    }

    private Projection parseProjection() {
        if (accept(TokenType.STAR)) {
            return new Projection(new StarExpression());
        }
        if (isIdentifierLike(peek()) && peekAt(1).is(TokenType.DOT) && peekAt(2).is(TokenType.STAR)) {
            String qualifier = advance().text();
            advance();
            advance();
            return new Projection(new StarExpression(qualifier));
        }
        Expression expr = parseExpression();
        String alias = null;
        if (acceptKeyword("AS")) {
            alias = parseIdentifier("alias after AS");
        }
        return new Projection(expr, alias);
    }

    private JoinClause parseJoin() {
        JoinClause.JoinType type = JoinClause.JoinType.INNER;
        if (acceptKeyword("LEFT")) {
            type = JoinClause.JoinType.LEFT;
            acceptKeyword("OUTER");
        } else if (acceptKeyword("RIGHT")) {
            type = JoinClause.JoinType.RIGHT;
            acceptKeyword("OUTER");
        } else {
            acceptKeyword("INNER");
        }
        expectKeyword("JOIN");
        TableReference table = parseTableReference();
        expectKeyword("ON");
        Expression first = parseAdditive();
        expect(TokenType.EQ, "'=' in join condition");
        Expression second = parseAdditive();
        if (!(first instanceof ColumnReference) || !(second instanceof ColumnReference)) {
            throw error("join condition must compare two columns");
        }
        return new JoinClause(type, table, (ColumnReference) first, (ColumnReference) second);
    }

    private List<OrderItem> parseOrderList() {
        List<OrderItem> items = new ArrayList<>();
        do {
            Expression expr = parseExpression();
            OrderItem.Direction direction = OrderItem.Direction.ASCENDING;
            if (acceptKeyword("DESC")) {
                direction = OrderItem.Direction.DESCENDING;
            } else {
                acceptKeyword("ASC");
            }
            items.add(new OrderItem(expr, direction));
        } while (accept(TokenType.COMMA));
        return items;
    }

    private List<DisplayOption> parseDisplayOptions() {
        List<DisplayOption> options = new ArrayList<>();
        do {
            Expression target = parseAdditive();
            Token text = peek();
            if (!text.is(TokenType.STRING)) {
                throw error("expected a quoted string after " + target.toSQL());
            }
            advance();
            options.add(new DisplayOption(target, text.text()));
        } while (accept(TokenType.COMMA));
        return options;
    }

    // ==================== INSERT / UPDATE / DELETE ====================

    private Statement parseInsert() {
        clause = "INSERT";
        advance();
        TableReference target = null;
        List<String> columns = new ArrayList<>();
        if (acceptKeyword("INTO")) {
            if (peek().is(TokenType.TABLE_REF) || peek().is(TokenType.RANGE)) {
                target = parseTableReference();
            }
        }
        if (accept(TokenType.LPAREN)) {
            clause = "INSERT";
            do {
                columns.add(parseIdentifier("column name"));
            } while (accept(TokenType.COMMA));
            expect(TokenType.RPAREN, "')' after column list");
        }
        if (target == null && acceptKeyword("FROM")) {
            clause = "FROM";
            target = parseTableReference();
        }
        clause = "VALUES";
        expectKeyword("VALUES");
        List<List<Expression>> rows = new ArrayList<>();
        do {
            expect(TokenType.LPAREN, "'(' before values");
            List<Expression> values = parseExpressionList();
            expect(TokenType.RPAREN, "')' after values");
            if (!columns.isEmpty() && values.size() != columns.size()) {
                throw error(String.format("%d column(s) named but %d value(s) given",
                    columns.size(), values.size()));
            }
            rows.add(values);
        } while (accept(TokenType.COMMA));
        if (acceptKeyword("FROM")) {
            clause = "FROM";
            if (target != null) {
                throw error("INSERT target given twice");
            }
            target = parseTableReference();
        }
        return new InsertStatement(target, columns, rows);
    }

    private Statement parseUpdate() {
        clause = "UPDATE";
        advance();
        TableReference target = null;
        if (peek().is(TokenType.TABLE_REF) || peek().is(TokenType.RANGE)) {
            target = parseTableReference();
        }
        clause = "SET";
        expectKeyword("SET");
        List<Assignment> assignments = new ArrayList<>();
        do {
            String column = parseIdentifier("column name in SET");
            expect(TokenType.EQ, "'=' in SET");
            assignments.add(new Assignment(column, parseExpression()));
        } while (accept(TokenType.COMMA));

        MutationClauses clauses = parseMutationClauses("UPDATE", target);
        return new UpdateStatement(clauses.target, assignments, clauses.where, clauses.orderBy, clauses.limit);
    }

    private Statement parseDelete() {
        clause = "DELETE";
        advance();
        MutationClauses clauses = parseMutationClauses("DELETE", null);
        return new DeleteStatement(clauses.target, clauses.where, clauses.orderBy, clauses.limit);
    }

    private static final class MutationClauses {
        TableReference target;
        Expression where;
        List<OrderItem> orderBy = Collections.emptyList();
        Integer limit;
    }

    private MutationClauses parseMutationClauses(String verb, TableReference target) {
        MutationClauses c = new MutationClauses();
        c.target = target;
        Set<String> seen = new HashSet<>();
        while (!atStatementEnd()) {
            String keyword = clauseKeyword(peek());
            if (!seen.add(keyword)) {
                throw error("duplicate " + keyword + " clause");
            }
            clause = keyword;
            switch (keyword) {
                case "FROM" -> {
                    advance();
                    if (c.target != null) {
                        throw error(verb + " target given twice");
                    }
                    c.target = parseTableReference();
                }
                case "WHERE" -> {
                    advance();
                    c.where = parseExpression();
                }
                case "ORDER BY" -> {
                    advance();
                    expectKeyword("BY");
                    c.orderBy = parseOrderList();
                }
                case "LIMIT" -> {
                    advance();
                    c.limit = parseNonNegativeInt();
                }
                default -> throw error("unexpected " + keyword + " in " + verb);
            }
        }
        return c;
    }

    // ==================== Table references ====================

    private TableReference parseTableReference() {
        Token t = peek();
        TableReference ref;
        if (t.is(TokenType.TABLE_REF)) {
            advance();
            ref = new VirtualTableRef(t.text(), parseOptionalAlias());
        } else if (t.is(TokenType.RANGE) || t.is(TokenType.STRING)) {
            advance();
            ref = new RangeRef(t.text().trim(), parseOptionalAlias());
        } else {
            throw error("expected :table or a range such as Sheet1!A:D");
        }
        return ref;
    }

    private String parseOptionalAlias() {
        if (acceptKeyword("AS")) {
            return parseIdentifier("alias after AS");
        }
        Token t = peek();
        if ((t.is(TokenType.IDENTIFIER) && !isReserved(t)) || t.is(TokenType.QUOTED_IDENTIFIER)) {
            advance();
            return t.text();
        }
        return null;
    }

    // ==================== Expressions ====================

    /**
     * Parses an expression; exposed for the precedence tests.
     */
    Expression parseExpression() {
        return parseOr();
    }

    private List<Expression> parseExpressionList() {
        List<Expression> list = new ArrayList<>();
        do {
            list.add(parseExpression());
        } while (accept(TokenType.COMMA));
        return list;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (acceptKeyword("OR")) {
            left = BinaryExpression.or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (acceptKeyword("AND")) {
            left = BinaryExpression.and(left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (acceptKeyword("NOT")) {
            return UnaryExpression.not(parseNot());
        }
        return parsePredicate();
    }

    private Expression parsePredicate() {
        Expression left = parseAdditive();
        Token t = peek();
        BinaryExpression.Operator op = switch (t.type()) {
            case EQ -> BinaryExpression.Operator.EQUAL;
            case NEQ -> BinaryExpression.Operator.NOT_EQUAL;
            case LT -> BinaryExpression.Operator.LESS_THAN;
            case LTE -> BinaryExpression.Operator.LESS_THAN_OR_EQUAL;
            case GT -> BinaryExpression.Operator.GREATER_THAN;
            case GTE -> BinaryExpression.Operator.GREATER_THAN_OR_EQUAL;
            default -> null;
        };
        if (op != null) {
            advance();
            return new BinaryExpression(left, op, parseAdditive());
        }
        if (t.isKeyword("IS")) {
            advance();
            boolean negated = acceptKeyword("NOT");
            expectKeyword("NULL");
            return negated ? UnaryExpression.isNotNull(left) : UnaryExpression.isNull(left);
        }
        if (t.isKeyword("CONTAINS")) {
            advance();
            return new BinaryExpression(left, BinaryExpression.Operator.CONTAINS, parseAdditive());
        }
        if (t.isKeyword("LIKE")) {
            advance();
            return new BinaryExpression(left, BinaryExpression.Operator.LIKE, parseAdditive());
        }
        if (t.isKeyword("MATCHES")) {
            advance();
            return new BinaryExpression(left, BinaryExpression.Operator.MATCHES, parseAdditive());
        }
        if ((t.isKeyword("STARTS") || t.isKeyword("ENDS")) && peekAt(1).isKeyword("WITH")) {
            advance();
            advance();
            BinaryExpression.Operator stringOp = t.isKeyword("STARTS")
                ? BinaryExpression.Operator.STARTS_WITH
                : BinaryExpression.Operator.ENDS_WITH;
            return new BinaryExpression(left, stringOp, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (true) {
            if (accept(TokenType.PLUS)) {
                left = new BinaryExpression(left, BinaryExpression.Operator.ADD, parseMultiplicative());
            } else if (accept(TokenType.MINUS)) {
                left = new BinaryExpression(left, BinaryExpression.Operator.SUBTRACT, parseMultiplicative());
            } else {
                return left;
            }
        }
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (true) {
            if (accept(TokenType.STAR)) {
                left = new BinaryExpression(left, BinaryExpression.Operator.MULTIPLY, parseUnary());
            } else if (accept(TokenType.SLASH)) {
                left = new BinaryExpression(left, BinaryExpression.Operator.DIVIDE, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Expression parseUnary() {
        if (accept(TokenType.MINUS)) {
            Expression operand = parseUnary();
            if (operand instanceof Literal lit && lit.value() instanceof NumberValue number) {
                return new Literal(new NumberValue(-number.value()));
            }
            return new UnaryExpression(UnaryExpression.Operator.NEGATE, operand);
        }
        if (accept(TokenType.PLUS)) {
            return parseUnary();
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER -> {
                advance();
                try {
                    return new Literal(new NumberValue(Double.parseDouble(t.text())));
                } catch (NumberFormatException e) {
                    throw new SQLParseException(clause, t.position(), t.text(), "malformed number");
                }
            }
            case STRING -> {
                advance();
                return new Literal(new StringValue(t.text()));
            }
            case LPAREN -> {
                advance();
                Expression inner = parseExpression();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case QUOTED_IDENTIFIER -> {
                advance();
                return parseColumnTail(t.text());
            }
            case IDENTIFIER -> {
                return parseIdentifierPrimary();
            }
            default -> throw error("expected an expression");
        }
    }

    private Expression parseIdentifierPrimary() {
        Token t = peek();
        String upper = t.text().toUpperCase(Locale.ROOT);
        switch (upper) {
            case "TRUE" -> {
                advance();
                return new Literal(BooleanValue.TRUE);
            }
            case "FALSE" -> {
                advance();
                return new Literal(BooleanValue.FALSE);
            }
            case "NULL" -> {
                advance();
                return new Literal(NullValue.get());
            }
            default -> {
                // DATE "..." / DATETIME "..." only when followed by a string; otherwise a column
                if ((upper.equals("DATE") || upper.equals("DATETIME") || upper.equals("TIMESTAMP"))
                        && peekAt(1).is(TokenType.STRING)) {
                    return parseDateLiteral(upper.equals("DATE"));
                }
            }
        }
        if (peekAt(1).is(TokenType.LPAREN)) {
            return parseCall();
        }
        if (isReserved(t)) {
            throw error("expected an expression");
        }
        advance();
        return parseColumnTail(t.text());
    }

    private Expression parseColumnTail(String first) {
        if (peek().is(TokenType.DOT) && isIdentifierLike(peekAt(1))) {
            advance();
            String column = advance().text();
            return ColumnReference.qualified(first, column);
        }
        return ColumnReference.of(first);
    }

    private Expression parseDateLiteral(boolean dateOnly) {
        advance();
        Token text = advance();
        Optional<DateValue> parsed = TypeCoercion.parseDateValue(text.text());
        if (parsed.isEmpty()) {
            throw new SQLParseException(clause, text.position(), text.text(),
                "invalid " + (dateOnly ? "date" : "datetime") + " literal, expected yyyy-MM-dd"
                    + (dateOnly ? "" : " HH:mm:ss"));
        }
        DateValue value = parsed.get();
        if (dateOnly) {
            value = DateValue.ofDate(value.value().toLocalDate());
        } else if (value.isDateOnly()) {
            value = DateValue.ofDateTime(value.value());
        }
        return new Literal(value);
    }

    private Expression parseCall() {
        Token name = advance();
        advance();
        AggregateExpression.Function aggregate = AggregateExpression.Function.fromName(name.text());
        if (aggregate != null) {
            if (aggregate == AggregateExpression.Function.COUNT && accept(TokenType.STAR)) {
                expect(TokenType.RPAREN, "')' after COUNT(*");
                return new AggregateExpression(aggregate, null, false);
            }
            boolean distinct = acceptKeyword("DISTINCT");
            Expression argument = parseExpression();
            expect(TokenType.RPAREN, "')' after aggregate argument");
            return new AggregateExpression(aggregate, argument, distinct);
        }
        FunctionCall.Function function = FunctionCall.Function.fromName(name.text());
        if (function == null) {
            throw new SQLParseException(clause, name.position(), name.text(), "unknown function");
        }
        List<Expression> args = new ArrayList<>();
        if (!peek().is(TokenType.RPAREN)) {
            args = parseExpressionList();
        }
        expect(TokenType.RPAREN, "')' after function arguments");
        if (args.size() != function.arity()) {
            throw new SQLParseException(clause, name.position(), name.text(),
                String.format("expects %d argument(s), got %d", function.arity(), args.size()));
        }
        return new FunctionCall(function, args);
    }

    private Integer parseNonNegativeInt() {
        Token t = peek();
        if (!t.is(TokenType.NUMBER) || !t.text().chars().allMatch(Character::isDigit)) {
            throw error("expected a non-negative integer");
        }
        advance();
        try {
            return Integer.parseInt(t.text());
        } catch (NumberFormatException e) {
            throw new SQLParseException(clause, t.position(), t.text(), "integer out of range");
        }
    }

    // ==================== Token helpers ====================

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        int i = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token advance() {
        Token t = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return t;
    }

    private boolean accept(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String what) {
        if (!accept(type)) {
            throw error("expected " + what);
        }
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("expected " + keyword);
        }
    }

    private String parseIdentifier(String what) {
        Token t = peek();
        if (t.is(TokenType.QUOTED_IDENTIFIER) || t.is(TokenType.STRING)
                || (t.is(TokenType.IDENTIFIER) && !isReserved(t))) {
            advance();
            return t.text();
        }
        throw error("expected " + what);
    }

    private boolean atStatementEnd() {
        return peek().is(TokenType.EOF) || peek().is(TokenType.SEMICOLON);
    }

    private boolean isJoinStart() {
        Token t = peek();
        return t.isKeyword("JOIN") || t.isKeyword("INNER")
            || ((t.isKeyword("LEFT") || t.isKeyword("RIGHT"))
                && (peekAt(1).isKeyword("JOIN") || peekAt(1).isKeyword("OUTER")));
    }

    private String clauseKeyword(Token t) {
        if (t.type() != TokenType.IDENTIFIER) {
            throw error("expected a clause keyword");
        }
        String upper = t.text().toUpperCase(Locale.ROOT);
        if (upper.equals("GROUP") || upper.equals("ORDER")) {
            return upper + " BY";
        }
        return upper;
    }

    private static boolean isReserved(Token t) {
        return t.is(TokenType.IDENTIFIER) && RESERVED.contains(t.text().toUpperCase(Locale.ROOT));
    }

    private static boolean isIdentifierLike(Token t) {
        return t.is(TokenType.IDENTIFIER) || t.is(TokenType.QUOTED_IDENTIFIER);
    }

    private SQLParseException error(String detail) {
        Token t = peek();
        return new SQLParseException(clause, t.position(), t.toString(), detail);
    }
}
