package com.calor.analysis.driver;

import com.calor.analysis.ir.BoundFunction;
import com.calor.analysis.ir.BoundModule;
import com.calor.verification.contract.BinaryOperator;
import com.calor.verification.contract.ContractExpr;
import com.calor.verification.contract.ContractExpr.Binary;
import com.calor.verification.contract.ContractExpr.IntLiteral;
import com.calor.verification.contract.ContractExpr.Opaque;
import com.calor.verification.contract.ContractExpr.Reference;

import java.util.List;

import static com.calor.analysis.ir.Ir.*;

/**
 * A small inventory service written against the stubs in test-fixtures/inventory-project.
 * Instance calls pass the receiver as their first argument.
 */
final class InventoryModule {

    static final String SERVICE = "Acme.Inventory.Service";
    static final String RESTOCK = SERVICE + "::Restock(System.String,System.Int32)";
    static final String AUDIT = SERVICE + "::Audit(System.String)";
    static final String COUNT = SERVICE + "::Count(System.String)";
    static final String PUBLISH = SERVICE + "::Publish()";
    static final String STAMP = SERVICE + "::Stamp()";
    static final String SUMMARY = SERVICE + "::Summary(System.String)";
    static final String RESERVE = SERVICE + "::Reserve(System.Int32)";

    private static final String DB = "Acme.Inventory.StockDb";

    private InventoryModule() {}

    static ContractExpr compare(BinaryOperator op, String name, long value) {
        return new Binary(op, new Reference(name), new IntLiteral(value));
    }

    static BoundModule build() {
        BoundFunction restock = withContracts(
                fn(RESTOCK, List.of(param("sku", "str"), param("qty", "i32")), List.of(
                        bindAt(11, "db", newObject(DB)),
                        exec(callAt(12, DB + "::Execute(System.String)", ref("db"), ref("sku"))),
                        exec(callAt(13, AUDIT, ref("sku"))),
                        ret(ref("qty"))), "db:w", "cw"),
                "i32",
                List.of(compare(BinaryOperator.GREATER_THAN, "qty", 0)),
                List.of(compare(BinaryOperator.GREATER_OR_EQUAL, "result", 0)));

        BoundFunction audit = fn(AUDIT, List.of(param("msg", "str")), List.of(
                printAt(21, ref("msg"))), "cw");

        BoundFunction count = fn(COUNT, List.of(param("sku", "str")), List.of(
                bindAt(30, "scratch", lit(0)),
                bindAt(31, "db", newObject(DB)),
                bindAt(32, "n", callAt(32, DB + "::Query(System.String)", ref("db"), ref("sku"))),
                ret(ref("n"))), "db:r");

        BoundFunction publish = fn(PUBLISH, List.of(
                exec(callAt(41, "Acme.Telemetry.Metrics::Emit(System.String)", lit(1)))), "cw", "net:w");

        BoundFunction stamp = fn(STAMP, List.of(
                bindAt(50, "now", callAt(50, "System.DateTime::get_Now()")),
                ret(ref("now"))));

        // Declares nothing but reaches the database through Count.
        BoundFunction summary = fn(SUMMARY, List.of(param("sku", "str")), List.of(
                bindAt(60, "n", callAt(60, COUNT, ref("sku"))),
                ret(ref("n"))));

        BoundFunction reserve = withContracts(
                fn(RESERVE, List.of(param("amount", "i32")), List.of(ret(ref("amount")))),
                "i32",
                List.of(compare(BinaryOperator.GREATER_THAN, "amount", 0)),
                List.of(compare(BinaryOperator.LESS_THAN, "result", 0), new Opaque("LambdaExpression")));

        return new BoundModule("Acme.Inventory", List.of(restock, audit, count, publish, stamp, summary, reserve));
    }
}
