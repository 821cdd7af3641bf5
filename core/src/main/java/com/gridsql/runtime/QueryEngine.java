package com.gridsql.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridsql.bridge.BridgeEligibility;
import com.gridsql.bridge.NativeQueryBridge;
import com.gridsql.config.EngineConfig;
import com.gridsql.exec.ExpressionEvaluator;
import com.gridsql.exec.MutationExecutor;
import com.gridsql.exec.SelectExecutor;
import com.gridsql.grid.GridSource;
import com.gridsql.grid.RemoteCalls;
import com.gridsql.logging.StatementLogger;
import com.gridsql.parser.StatementParser;
import com.gridsql.result.ExecutionResult;
import com.gridsql.result.MutationSummary;
import com.gridsql.result.QueryResult;
import com.gridsql.result.SelectResult;
import com.gridsql.statement.DeleteStatement;
import com.gridsql.statement.InsertStatement;
import com.gridsql.statement.SelectStatement;
import com.gridsql.statement.Statement;
import com.gridsql.statement.UpdateStatement;
import com.gridsql.statement.VirtualTableRef;
import com.gridsql.table.GridLocation;
import com.gridsql.table.TableResolver;
import com.gridsql.table.VirtualTableSet;
import com.gridsql.validation.StatementValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point: parses, validates and executes one statement per call.
 *
 * <p>Each call moves through {@code Parsed -> Resolved -> {Bridged | Evaluated} -> Result}
 * or stops at the first failure. Validation completes before any remote call, and the
 * engine never retries. No state is kept between calls, so one engine may serve
 * concurrent callers when its {@link GridSource} is thread-safe.
 *
 * <p>Example usage:
 * <pre>
 *   QueryEngine engine = new QueryEngine(gridSource);
 *
 *   // Query a grid range
 *   ExecutionResult result = engine.execute(
 *       "SELECT A, SUM(C) GROUP BY A", GridLocation.of(spreadsheetId, "Sheet1!A:C"));
 *
 *   // Update a virtual table
 *   ExecutionResult summary = engine.execute(
 *       "UPDATE :data SET Status = 'done' WHERE Amount > 50", null, Map.of("data", rows), false);
 * </pre>
 *
 * @see StatementParser
 * @see StatementValidator
 */
public class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final GridSource gridSource;
    private final EngineConfig config;

    /**
     * Creates an engine configured from system properties.
     *
     * @param gridSource the grid collaborator (may be null for virtual tables only)
     */
    public QueryEngine(GridSource gridSource) {
        this(gridSource, EngineConfig.fromSystemProperties());
    }

    /**
     * Creates an engine.
     *
     * @param gridSource the grid collaborator (may be null for virtual tables only)
     * @param config the configuration
     */
    public QueryEngine(GridSource gridSource, EngineConfig config) {
        this.gridSource = gridSource;
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public EngineConfig config() {
        return config;
    }

    public ExecutionResult execute(String statement, GridLocation target) {
        return execute(statement, target, null, false);
    }

    public ExecutionResult execute(String statement, Map<String, List<List<Object>>> virtualTables) {
        return execute(statement, null, virtualTables, false);
    }

    /**
     * Executes one statement.
     *
     * @param statement the statement text
     * @param target the default grid range (may be null when only virtual tables are used)
     * @param virtualTables the {@code :name} tables for this call (may be null)
     * @param returnMetadata whether a grid SELECT also returns cell metadata
     * @return a {@link SelectResult} or a {@link MutationSummary}
     * @throws com.gridsql.exception.SQLParseException if the statement does not parse
     * @throws com.gridsql.exception.ValidationException if validation fails
     * @throws com.gridsql.exception.RemoteAccessException if a grid call fails
     */
    public ExecutionResult execute(String statement, GridLocation target,
                                   Map<String, List<List<Object>>> virtualTables, boolean returnMetadata) {
        Objects.requireNonNull(statement, "statement must not be null");

        String statementId = StatementLogger.newStatementId();
        StatementLogger.start(statementId);
        long startTime = System.nanoTime();

        try {
            Statement stmt = StatementParser.parse(statement);
            StatementLogger.logParse(stmt.operation(), elapsedMs(startTime));

            TableResolver resolver = new TableResolver(
                config, gridSource, new VirtualTableSet(virtualTables), target);
            StatementValidator.validate(stmt, resolver);

            ExpressionEvaluator evaluator = new ExpressionEvaluator(config);
            ExecutionResult result;
            String route;
            if (stmt instanceof SelectStatement select) {
                Optional<String> ineligible = BridgeEligibility.check(select, config);
                route = ineligible.isPresent() ? "evaluated" : "bridged";
                StatementLogger.logRoute(route, ineligible.orElse("single grid range"));
                QueryResult data = ineligible.isPresent()
                    ? new SelectExecutor(evaluator).execute(select, resolver)
                    : new NativeQueryBridge(gridSource, evaluator.today(), config.headerRows())
                        .execute(select, resolver.locationOf(select.source()));
                result = new SelectResult(data, returnMetadata ? metadata(select, resolver) : null);
            } else {
                route = stmt.source() instanceof VirtualTableRef ? "virtual table" : "grid range";
                StatementLogger.logRoute(route, stmt.operation());
                result = mutate(stmt, new MutationExecutor(evaluator), resolver);
            }

            int rows = result instanceof SelectResult s ? s.data().rowCount()
                : ((MutationSummary) result).affectedRows();
            StatementLogger.logCompletion(stmt.operation(), route, rows, elapsedMs(startTime));
            return result;
        } catch (RuntimeException e) {
            StatementLogger.logFailure(e);
            throw e;
        } finally {
            StatementLogger.end();
        }
    }

    private static MutationSummary mutate(Statement stmt, MutationExecutor executor, TableResolver resolver) {
        if (stmt instanceof UpdateStatement update) {
            return executor.update(update, resolver);
        } else if (stmt instanceof DeleteStatement delete) {
            return executor.delete(delete, resolver);
        } else if (stmt instanceof InsertStatement insert) {
            return executor.insert(insert, resolver);
        }
        throw new IllegalStateException("Not a mutation: " + stmt.operation());
    }

    private JsonNode metadata(SelectStatement select, TableResolver resolver) {
        if (select.source() instanceof VirtualTableRef) {
            logger.debug("Metadata requested for a virtual table; ignored");
            return null;
        }
        GridLocation location = resolver.locationOf(select.source());
        return RemoteCalls.invoke("metadata", location.toString(), () -> gridSource.readMetadata(location));
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
