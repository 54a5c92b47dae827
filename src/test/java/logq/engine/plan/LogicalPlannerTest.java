package logq.engine.plan;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import logq.engine.catalog.LogCatalog;
import logq.engine.exception.InvalidLogFormatException;
import logq.engine.exception.PhysicalPlanException;
import logq.engine.exception.PlanningException;
import logq.engine.query.QueryParser;
import logq.engine.query.SelectStatement;
import logq.engine.storage.FileDataSource;
import logq.engine.storage.InMemoryDataSource;
import logq.engine.types.Value;

public class LogicalPlannerTest {
    private final LogicalPlanner planner = new LogicalPlanner();

    private LogicalNode plan(String query) {
        SelectStatement s = new QueryParser().parse(query).statement();
        return planner.plan(s);
    }

    @Test
    void starExpandsToSchemaOrder() {
        LogicalNode root = plan("SELECT * FROM alb");
        assertEquals(LogCatalog.ALB.columnNames(), root.outputColumns());
        assertEquals(29, root.outputColumns().size());
    }

    @Test
    void buildsScanFilterProjectLimit() {
        LogicalNode root = plan("SELECT elbname FROM elb WHERE elb_status_code >= 500 LIMIT 5");
        LogicalLimit limit = assertInstanceOf(LogicalLimit.class, root);
        assertEquals(5, limit.limit());
        LogicalProject project = assertInstanceOf(LogicalProject.class, limit.input());
        LogicalFilter filter = assertInstanceOf(LogicalFilter.class, project.input());
        BoundExpression.Compare cond = assertInstanceOf(BoundExpression.Compare.class, filter.condition());
        assertEquals(new BoundExpression.Constant(Value.of(500L)), cond.right());
        LogicalScan scan = assertInstanceOf(LogicalScan.class, filter.input());
        assertSame(LogCatalog.ELB, scan.schema());
        assertEquals(List.of("elbname"), root.outputColumns());
    }

    @Test
    void projectIsAlwaysPresent() {
        LogicalNode root = plan("SELECT * FROM squid");
        LogicalProject project = assertInstanceOf(LogicalProject.class, root);
        assertInstanceOf(LogicalScan.class, project.input());
    }

    @Test
    void unknownProjectionColumnIsNamed() {
        PlanningException e = assertThrows(PlanningException.class, () -> plan("SELECT foo FROM elb"));
        assertTrue(e.getMessage().contains("'foo'"), e.getMessage());
        assertTrue(e.getMessage().contains("known columns"), e.getMessage());
    }

    @Test
    void duplicateProjectionColumnIsRejected() {
        assertThrows(PlanningException.class, () -> plan("SELECT elbname, elbname FROM elb"));
    }

    @Test
    void unknownFormatIsRejected() {
        InvalidLogFormatException e = assertThrows(InvalidLogFormatException.class, () -> plan("SELECT * FROM bogus"));
        assertEquals("bogus", e.tableName());
    }

    @Test
    void lowersLiteralsAndLimitIntoVariables() {
        LogicalNode root = plan("SELECT elbname FROM elb WHERE elb_status_code >= 500 AND elbname != 'x' LIMIT 5");
        PhysicalPlanResult result = root.physical(new PhysicalPlanCreator(InMemoryDataSource.of()));

        assertEquals(List.of("limit_0", "const_0", "const_1"), List.copyOf(result.variables().asMap().keySet()));
        assertEquals(Value.of(5L), result.variables().get("limit_0"));
        assertEquals(Value.of(500L), result.variables().get("const_0"));
        assertEquals(Value.of("x"), result.variables().get("const_1"));

        String explain = result.plan().explain();
        assertTrue(explain.startsWith("Limit(:limit_0)"), explain);
        assertTrue(explain.contains("elb_status_code >= :const_0"), explain);
        assertTrue(explain.contains("decode=[elbname, elb_status_code]"), explain);
    }

    @Test
    void missingFileFailsAtPhysicalPlanning(@TempDir Path dir) {
        LogicalNode root = plan("SELECT * FROM elb");
        Path missing = dir.resolve("missing.log");
        PhysicalPlanException e = assertThrows(PhysicalPlanException.class,
            () -> root.physical(new PhysicalPlanCreator(new FileDataSource(missing))));
        assertEquals(missing.toString(), e.source());
        assertTrue(e.getMessage().contains("file not found"), e.getMessage());
    }

    @Test
    void variableNamesAreNumberedPerPrefix() {
        PhysicalPlanCreator creator = new PhysicalPlanCreator(InMemoryDataSource.of());
        assertEquals("const_0", creator.newVariableName("const"));
        assertEquals("limit_0", creator.newVariableName("limit"));
        assertEquals("const_1", creator.newVariableName("const"));
    }
}
