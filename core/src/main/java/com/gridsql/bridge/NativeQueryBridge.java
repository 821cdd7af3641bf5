package com.gridsql.bridge;

import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.grid.GridSource;
import com.gridsql.grid.RemoteCalls;
import com.gridsql.result.QueryResult;
import com.gridsql.result.ResultColumn;
import com.gridsql.statement.Projection;
import com.gridsql.statement.SelectStatement;
import com.gridsql.table.GridLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs an eligible SELECT in the grid's native dialect.
 *
 * <p>The native response is reshaped so the result cannot be told apart from direct
 * evaluation: column ids become the projection's alias, column letter or expression
 * text, and labels of computed columns without an alias or LABEL become the
 * expression text. Star and PIVOT columns keep the ids the grid reports.
 */
public final class NativeQueryBridge {

    private static final Logger logger = LoggerFactory.getLogger(NativeQueryBridge.class);

    private final GridSource gridSource;
    private final NativeQueryGenerator generator;
    private final NativeResponseParser parser;
    private final int headerRows;

    /**
     * @param gridSource the grid collaborator
     * @param today the date {@code TODAY()} stands for
     * @param headerRows leading rows of the range that hold labels
     */
    public NativeQueryBridge(GridSource gridSource, LocalDate today, int headerRows) {
        this.gridSource = gridSource;
        this.generator = new NativeQueryGenerator(today);
        this.parser = new NativeResponseParser();
        this.headerRows = headerRows;
    }

    /**
     * Translates, runs and reshapes a statement.
     *
     * @param stmt an eligible statement
     * @param location the range it reads
     * @return the result
     */
    public QueryResult execute(SelectStatement stmt, GridLocation location) {
        String query = generator.generate(stmt);
        logger.debug("Native query for {}: {}", location, query);
        String body = RemoteCalls.invoke("query", location.toString(),
            () -> gridSource.query(location, query, headerRows));
        QueryResult raw = parser.parse(body, location.toString());
        return reshape(stmt, raw);
    }

    static QueryResult reshape(SelectStatement stmt, QueryResult raw) {
        List<Projection> projections = stmt.projections();
        if (!stmt.pivot().isEmpty() || projections.size() != raw.columns().size()
                || projections.stream().anyMatch(Projection::isStar)) {
            return raw;
        }
        List<ResultColumn> columns = new ArrayList<>(projections.size());
        for (int i = 0; i < projections.size(); i++) {
            Projection p = projections.get(i);
            ResultColumn reported = raw.columns().get(i);
            Expression expr = p.expression();
            String id;
            String label = reported.label();
            if (p.alias() != null) {
                id = p.alias();
            } else if (expr instanceof ColumnReference ref) {
                id = ref.columnName();
            } else {
                id = expr.toSQL();
                if (!isLabelled(stmt, p)) {
                    label = id;
                }
            }
            columns.add(new ResultColumn(id, label, reported.type(), reported.pattern()));
        }
        return new QueryResult(columns, raw.rows());
    }

    private static boolean isLabelled(SelectStatement stmt, Projection p) {
        return stmt.labels().stream().anyMatch(label -> p.expression().equals(label.target()));
    }
}
