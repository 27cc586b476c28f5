package com.brokerbridge.engine.table;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.engine.contract.Contract;
import com.brokerbridge.tables.ColumnType;
import com.brokerbridge.tables.TableRow;
import com.brokerbridge.tables.TableSchema;
import com.brokerbridge.tables.TableSink;
import com.brokerbridge.tables.TableWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The live tables of one broker session and their writers.
 *
 * <p>All tables are defined on the sink when the session is created, so they exist
 * (empty) before the first event arrives.</p>
 */
public class SessionTables {

    public static final String REQUESTS = "requests";
    public static final String ERRORS = "errors";

    public static final String CONTRACTS_DETAILS = "contracts_details";
    public static final String CONTRACTS_MATCHING = "contracts_matching";
    public static final String MARKET_RULES = "market_rules";

    public static final String ACCOUNTS_MANAGED = "accounts_managed";
    public static final String ACCOUNTS_FAMILY_CODES = "accounts_family_codes";
    public static final String ACCOUNTS_GROUPS = "accounts_groups";
    public static final String ACCOUNTS_ALIASES = "accounts_aliases";
    public static final String ACCOUNTS_OVERVIEW = "accounts_overview";
    public static final String ACCOUNTS_SUMMARY = "accounts_summary";
    public static final String ACCOUNTS_POSITIONS = "accounts_positions";
    public static final String ACCOUNTS_PNL = "accounts_pnl";

    public static final String NEWS_PROVIDERS = "news_providers";
    public static final String NEWS_BULLETINS = "news_bulletins";
    public static final String NEWS_ARTICLES = "news_articles";
    public static final String NEWS_HISTORICAL = "news_historical";

    public static final String TICKS_PRICE = "ticks_price";
    public static final String TICKS_SIZE = "ticks_size";
    public static final String TICKS_STRING = "ticks_string";
    public static final String TICKS_GENERIC = "ticks_generic";
    public static final String TICKS_OPTION_COMPUTATION = "ticks_option_computation";
    public static final String TICKS_TRADE = "ticks_trade";
    public static final String TICKS_BID_ASK = "ticks_bid_ask";
    public static final String TICKS_MID_POINT = "ticks_mid_point";
    public static final String BARS_HISTORICAL = "bars_historical";
    public static final String BARS_REALTIME = "bars_realtime";

    public static final String ORDERS_SUBMITTED = "orders_submitted";
    public static final String ORDERS_STATUS = "orders_status";
    public static final String ORDERS_COMPLETED = "orders_completed";
    public static final String ORDERS_EXEC_DETAILS = "orders_exec_details";
    public static final String ORDERS_EXEC_COMMISSION_REPORT = "orders_exec_commission_report";
    public static final String ORDERS = "orders";

    public static final String SHORT_RATES = "short_rates";

    private final Map<String, TableWriter> writers = new TreeMap<>();

    public SessionTables(TableSink sink, ClockProvider clock) {
        for (TableSchema schema : schemas()) {
            writers.put(schema.getName(), new TableWriter(schema, sink, clock));
        }
    }

    public TableWriter writer(String table) {
        TableWriter writer = writers.get(table);
        if (writer == null) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        return writer;
    }

    /**
     * Start a row for {@code table}; values are added in column order, after {@code ReceiveTime}.
     */
    public RowBuilder row(String table) {
        return new RowBuilder(writer(table));
    }

    public List<String> getTableNames() {
        return Collections.unmodifiableList(new ArrayList<>(writers.keySet()));
    }

    /**
     * Columns describing a contract, shared by every table that carries one.
     */
    static List<TableSchema.Column> contractColumns(String exchangeColumn) {
        List<TableSchema.Column> columns = new ArrayList<>();
        columns.add(new TableSchema.Column("ContractId", ColumnType.LONG));
        columns.add(new TableSchema.Column("Symbol", ColumnType.STRING));
        columns.add(new TableSchema.Column("SecType", ColumnType.STRING));
        columns.add(new TableSchema.Column("LastTradeDateOrContractMonth", ColumnType.STRING));
        columns.add(new TableSchema.Column("Strike", ColumnType.DOUBLE));
        columns.add(new TableSchema.Column("Right", ColumnType.STRING));
        columns.add(new TableSchema.Column("Multiplier", ColumnType.STRING));
        columns.add(new TableSchema.Column(exchangeColumn, ColumnType.STRING));
        columns.add(new TableSchema.Column("PrimaryExchange", ColumnType.STRING));
        columns.add(new TableSchema.Column("Currency", ColumnType.STRING));
        columns.add(new TableSchema.Column("LocalSymbol", ColumnType.STRING));
        columns.add(new TableSchema.Column("TradingClass", ColumnType.STRING));
        return columns;
    }

    private static List<TableSchema.Column> orderColumns() {
        List<TableSchema.Column> columns = new ArrayList<>(contractColumns("Exchange"));
        columns.add(new TableSchema.Column("OrderId", ColumnType.LONG));
        columns.add(new TableSchema.Column("PermId", ColumnType.LONG));
        columns.add(new TableSchema.Column("ClientId", ColumnType.LONG));
        columns.add(new TableSchema.Column("Account", ColumnType.STRING));
        columns.add(new TableSchema.Column("Action", ColumnType.STRING));
        columns.add(new TableSchema.Column("OrderType", ColumnType.STRING));
        columns.add(new TableSchema.Column("TotalQuantity", ColumnType.DOUBLE));
        columns.add(new TableSchema.Column("LmtPrice", ColumnType.DOUBLE));
        columns.add(new TableSchema.Column("AuxPrice", ColumnType.DOUBLE));
        columns.add(new TableSchema.Column("TimeInForce", ColumnType.STRING));
        columns.add(new TableSchema.Column("OrderRef", ColumnType.STRING));
        columns.add(new TableSchema.Column("Status", ColumnType.STRING));
        return columns;
    }

    static List<TableSchema> schemas() {
        List<TableSchema> schemas = new ArrayList<>();

        schemas.add(TableSchema.builder(REQUESTS)
                .column("RequestId", ColumnType.LONG)
                .column("RequestType", ColumnType.STRING)
                .column("Action", ColumnType.STRING)
                .column("Symbol", ColumnType.STRING)
                .column("SecType", ColumnType.STRING)
                .column("Exchange", ColumnType.STRING)
                .column("Currency", ColumnType.STRING)
                .column("Note", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(ERRORS)
                .column("RequestId", ColumnType.LONG)
                .column("ErrorCode", ColumnType.LONG)
                .column("ErrorDescription", ColumnType.STRING)
                .column("Error", ColumnType.STRING)
                .column("Note", ColumnType.STRING)
                .build());

        schemas.add(TableSchema.builder(CONTRACTS_DETAILS)
                .column("RequestId", ColumnType.LONG)
                .columns(contractColumns("Exchange"))
                .column("MarketName", ColumnType.STRING)
                .column("LongName", ColumnType.STRING)
                .column("MinTick", ColumnType.DOUBLE)
                .column("ValidExchanges", ColumnType.STRING)
                .column("MarketRuleIds", ColumnType.STRING)
                .column("TimeZoneId", ColumnType.STRING)
                .column("Industry", ColumnType.STRING)
                .column("Category", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(CONTRACTS_MATCHING)
                .column("RequestId", ColumnType.LONG)
                .columns(contractColumns("Exchange"))
                .column("DerivativeSecTypes", ColumnType.STRING_SET)
                .build());
        schemas.add(TableSchema.builder(MARKET_RULES)
                .column("MarketRuleId", ColumnType.STRING)
                .column("LowEdge", ColumnType.DOUBLE)
                .column("Increment", ColumnType.DOUBLE)
                .build());

        schemas.add(TableSchema.builder(ACCOUNTS_MANAGED)
                .column("Account", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(ACCOUNTS_FAMILY_CODES)
                .column("AccountId", ColumnType.STRING)
                .column("FamilyCode", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(ACCOUNTS_GROUPS)
                .column("GroupName", ColumnType.STRING)
                .column("DefaultMethod", ColumnType.STRING)
                .column("Account", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(ACCOUNTS_ALIASES)
                .column("Account", ColumnType.STRING)
                .column("Alias", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(ACCOUNTS_OVERVIEW)
                .column("RequestId", ColumnType.LONG)
                .column("Account", ColumnType.STRING)
                .column("ModelCode", ColumnType.STRING)
                .column("Currency", ColumnType.STRING)
                .column("Key", ColumnType.STRING)
                .column("Value", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(ACCOUNTS_SUMMARY)
                .column("RequestId", ColumnType.LONG)
                .column("Account", ColumnType.STRING)
                .column("Tag", ColumnType.STRING)
                .column("Value", ColumnType.STRING)
                .column("Currency", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(ACCOUNTS_POSITIONS)
                .column("RequestId", ColumnType.LONG)
                .column("Account", ColumnType.STRING)
                .column("ModelCode", ColumnType.STRING)
                .columns(contractColumns("Exchange"))
                .column("Position", ColumnType.DOUBLE)
                .column("AvgCost", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(ACCOUNTS_PNL)
                .column("RequestId", ColumnType.LONG)
                .column("DailyPnl", ColumnType.DOUBLE)
                .column("UnrealizedPnl", ColumnType.DOUBLE)
                .column("RealizedPnl", ColumnType.DOUBLE)
                .build());

        schemas.add(TableSchema.builder(NEWS_PROVIDERS)
                .column("ProviderCode", ColumnType.STRING)
                .column("ProviderName", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(NEWS_BULLETINS)
                .column("MsgId", ColumnType.LONG)
                .column("MsgType", ColumnType.STRING)
                .column("Message", ColumnType.STRING)
                .column("OriginExch", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(NEWS_ARTICLES)
                .column("RequestId", ColumnType.LONG)
                .column("ArticleType", ColumnType.STRING)
                .column("ArticleText", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(NEWS_HISTORICAL)
                .column("RequestId", ColumnType.LONG)
                .column("Timestamp", ColumnType.INSTANT)
                .column("ProviderCode", ColumnType.STRING)
                .column("ArticleId", ColumnType.STRING)
                .column("Headline", ColumnType.STRING)
                .build());

        schemas.add(TableSchema.builder(TICKS_PRICE)
                .column("RequestId", ColumnType.LONG)
                .column("TickType", ColumnType.STRING)
                .column("Price", ColumnType.DOUBLE)
                .column("CanAutoExecute", ColumnType.BOOLEAN)
                .column("PastLimit", ColumnType.BOOLEAN)
                .column("PreOpen", ColumnType.BOOLEAN)
                .build());
        schemas.add(TableSchema.builder(TICKS_SIZE)
                .column("RequestId", ColumnType.LONG)
                .column("TickType", ColumnType.STRING)
                .column("Size", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(TICKS_STRING)
                .column("RequestId", ColumnType.LONG)
                .column("TickType", ColumnType.STRING)
                .column("Value", ColumnType.STRING)
                .build());
        schemas.add(TableSchema.builder(TICKS_GENERIC)
                .column("RequestId", ColumnType.LONG)
                .column("TickType", ColumnType.STRING)
                .column("Value", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(TICKS_OPTION_COMPUTATION)
                .column("RequestId", ColumnType.LONG)
                .column("TickType", ColumnType.STRING)
                .column("TickAttrib", ColumnType.STRING)
                .column("ImpliedVol", ColumnType.DOUBLE)
                .column("Delta", ColumnType.DOUBLE)
                .column("OptPrice", ColumnType.DOUBLE)
                .column("PvDividend", ColumnType.DOUBLE)
                .column("Gamma", ColumnType.DOUBLE)
                .column("Vega", ColumnType.DOUBLE)
                .column("Theta", ColumnType.DOUBLE)
                .column("UndPrice", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(TICKS_TRADE)
                .column("RequestId", ColumnType.LONG)
                .column("Timestamp", ColumnType.INSTANT)
                .column("Price", ColumnType.DOUBLE)
                .column("Size", ColumnType.DOUBLE)
                .column("Exchange", ColumnType.STRING)
                .column("SpecialConditions", ColumnType.STRING)
                .column("PastLimit", ColumnType.BOOLEAN)
                .column("Unreported", ColumnType.BOOLEAN)
                .build());
        schemas.add(TableSchema.builder(TICKS_BID_ASK)
                .column("RequestId", ColumnType.LONG)
                .column("Timestamp", ColumnType.INSTANT)
                .column("BidPrice", ColumnType.DOUBLE)
                .column("AskPrice", ColumnType.DOUBLE)
                .column("BidSize", ColumnType.DOUBLE)
                .column("AskSize", ColumnType.DOUBLE)
                .column("BidPastLow", ColumnType.BOOLEAN)
                .column("AskPastHigh", ColumnType.BOOLEAN)
                .build());
        schemas.add(TableSchema.builder(TICKS_MID_POINT)
                .column("RequestId", ColumnType.LONG)
                .column("Timestamp", ColumnType.INSTANT)
                .column("MidPoint", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(BARS_HISTORICAL)
                .column("RequestId", ColumnType.LONG)
                .column("Timestamp", ColumnType.INSTANT)
                .column("Open", ColumnType.DOUBLE)
                .column("High", ColumnType.DOUBLE)
                .column("Low", ColumnType.DOUBLE)
                .column("Close", ColumnType.DOUBLE)
                .column("Volume", ColumnType.DOUBLE)
                .column("BarCount", ColumnType.LONG)
                .column("VWAP", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(BARS_REALTIME)
                .column("RequestId", ColumnType.LONG)
                .column("Timestamp", ColumnType.INSTANT)
                .column("TimestampEnd", ColumnType.INSTANT)
                .column("Open", ColumnType.DOUBLE)
                .column("High", ColumnType.DOUBLE)
                .column("Low", ColumnType.DOUBLE)
                .column("Close", ColumnType.DOUBLE)
                .column("Volume", ColumnType.DOUBLE)
                .column("WAP", ColumnType.DOUBLE)
                .column("Count", ColumnType.LONG)
                .build());

        schemas.add(TableSchema.builder(ORDERS_SUBMITTED)
                .columns(orderColumns())
                .build());
        schemas.add(TableSchema.builder(ORDERS_STATUS)
                .column("OrderId", ColumnType.LONG)
                .column("Status", ColumnType.STRING)
                .column("Filled", ColumnType.DOUBLE)
                .column("Remaining", ColumnType.DOUBLE)
                .column("AvgFillPrice", ColumnType.DOUBLE)
                .column("PermId", ColumnType.LONG)
                .column("ParentId", ColumnType.LONG)
                .column("LastFillPrice", ColumnType.DOUBLE)
                .column("ClientId", ColumnType.LONG)
                .column("WhyHeld", ColumnType.STRING)
                .column("MktCapPrice", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(ORDERS_COMPLETED)
                .columns(orderColumns())
                .column("CompletedTime", ColumnType.STRING)
                .column("CompletedStatus", ColumnType.STRING)
                .build());
        List<TableSchema.Column> execContract = contractColumns("ContractExchange");
        schemas.add(TableSchema.builder(ORDERS_EXEC_DETAILS)
                .column("RequestId", ColumnType.LONG)
                .columns(execContract)
                .column("ExecId", ColumnType.STRING)
                .column("OrderId", ColumnType.LONG)
                .column("Time", ColumnType.STRING)
                .column("Account", ColumnType.STRING)
                .column("ExecutionExchange", ColumnType.STRING)
                .column("Side", ColumnType.STRING)
                .column("Shares", ColumnType.DOUBLE)
                .column("Price", ColumnType.DOUBLE)
                .column("PermId", ColumnType.LONG)
                .column("CumQty", ColumnType.DOUBLE)
                .column("AvgPrice", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(ORDERS_EXEC_COMMISSION_REPORT)
                .column("ExecId", ColumnType.STRING)
                .column("Commission", ColumnType.DOUBLE)
                .column("Currency", ColumnType.STRING)
                .column("RealizedPnl", ColumnType.DOUBLE)
                .build());
        schemas.add(TableSchema.builder(ORDERS)
                .column("OrderId", ColumnType.LONG)
                .column("ContractId", ColumnType.LONG)
                .column("Symbol", ColumnType.STRING)
                .column("Action", ColumnType.STRING)
                .column("OrderType", ColumnType.STRING)
                .column("Quantity", ColumnType.DOUBLE)
                .column("LimitPrice", ColumnType.DOUBLE)
                .column("State", ColumnType.STRING)
                .column("PreviousState", ColumnType.STRING)
                .column("Filled", ColumnType.DOUBLE)
                .column("Remaining", ColumnType.DOUBLE)
                .column("AvgFillPrice", ColumnType.DOUBLE)
                .column("External", ColumnType.BOOLEAN)
                .column("UpstreamStatus", ColumnType.STRING)
                .build());

        schemas.add(TableSchema.builder(SHORT_RATES)
                .column("Source", ColumnType.STRING)
                .column("Sym", ColumnType.STRING)
                .column("Currency", ColumnType.STRING)
                .column("Name", ColumnType.STRING)
                .column("Contract", ColumnType.LONG)
                .column("RebateRate", ColumnType.DOUBLE)
                .column("FeeRate", ColumnType.DOUBLE)
                .column("Available", ColumnType.STRING)
                .build());

        return schemas;
    }

    /**
     * Collects the values of one row.
     */
    public static final class RowBuilder {
        private final TableWriter writer;
        private final List<Object> values = new ArrayList<>();

        private RowBuilder(TableWriter writer) {
            this.writer = writer;
        }

        public RowBuilder add(Object value) {
            values.add(value);
            return this;
        }

        /**
         * Add the shared contract columns. A null contract writes nulls.
         */
        public RowBuilder contract(Contract contract) {
            if (contract == null) {
                for (int i = 0; i < 12; i++) {
                    values.add(null);
                }
                return this;
            }
            values.add(contract.getConId() > 0 ? (long) contract.getConId() : null);
            values.add(contract.getSymbol());
            values.add(contract.getSecType());
            values.add(contract.getLastTradeDateOrContractMonth());
            values.add(contract.getStrike() != 0 ? contract.getStrike() : null);
            values.add(contract.getRight());
            values.add(contract.getMultiplier());
            values.add(contract.getExchange());
            values.add(contract.getPrimaryExchange());
            values.add(contract.getCurrency());
            values.add(contract.getLocalSymbol());
            values.add(contract.getTradingClass());
            return this;
        }

        public TableRow write() {
            return writer.write(values.toArray());
        }
    }
}
