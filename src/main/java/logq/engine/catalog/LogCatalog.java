package logq.engine.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide, read-only table of the supported log formats keyed by the name used in
 * the FROM clause. Initialised once; safe to share between concurrent queries.
 */
public final class LogCatalog {
    private LogCatalog() {}

    public static final LogSchema ELB = new LogSchema("elb", List.of(
        new ColumnSchema("timestamp", DataType.DATE_TIME),
        new ColumnSchema("elbname", DataType.STRING),
        new ColumnSchema("client_and_port", DataType.HOST),
        new ColumnSchema("backend_and_port", DataType.HOST),
        new ColumnSchema("request_processing_time", DataType.FLOAT),
        new ColumnSchema("backend_processing_time", DataType.FLOAT),
        new ColumnSchema("response_processing_time", DataType.FLOAT),
        new ColumnSchema("elb_status_code", DataType.INT),
        new ColumnSchema("backend_status_code", DataType.INT),
        new ColumnSchema("received_bytes", DataType.INT),
        new ColumnSchema("sent_bytes", DataType.INT),
        new ColumnSchema("request", DataType.HTTP_REQUEST),
        new ColumnSchema("user_agent", DataType.STRING),
        new ColumnSchema("ssl_cipher", DataType.STRING),
        new ColumnSchema("ssl_protocol", DataType.STRING)
    ), 15, false);

    // AWS appends fields to ALB and S3 logs over time, so both tolerate extra trailing fields
    // and older lines that stop before the newest columns.
    public static final LogSchema ALB = new LogSchema("alb", List.of(
        new ColumnSchema("type", DataType.STRING),
        new ColumnSchema("timestamp", DataType.DATE_TIME),
        new ColumnSchema("elb", DataType.STRING),
        new ColumnSchema("client_and_port", DataType.HOST),
        new ColumnSchema("target_and_port", DataType.HOST),
        new ColumnSchema("request_processing_time", DataType.FLOAT),
        new ColumnSchema("target_processing_time", DataType.FLOAT),
        new ColumnSchema("response_processing_time", DataType.FLOAT),
        new ColumnSchema("elb_status_code", DataType.INT),
        new ColumnSchema("target_status_code", DataType.INT),
        new ColumnSchema("received_bytes", DataType.INT),
        new ColumnSchema("sent_bytes", DataType.INT),
        new ColumnSchema("request", DataType.HTTP_REQUEST),
        new ColumnSchema("user_agent", DataType.STRING),
        new ColumnSchema("ssl_cipher", DataType.STRING),
        new ColumnSchema("ssl_protocol", DataType.STRING),
        new ColumnSchema("target_group_arn", DataType.STRING),
        new ColumnSchema("trace_id", DataType.STRING),
        new ColumnSchema("domain_name", DataType.STRING),
        new ColumnSchema("chosen_cert_arn", DataType.STRING),
        new ColumnSchema("matched_rule_priority", DataType.INT),
        new ColumnSchema("request_creation_time", DataType.DATE_TIME),
        new ColumnSchema("actions_executed", DataType.STRING),
        new ColumnSchema("redirect_url", DataType.STRING),
        new ColumnSchema("error_reason", DataType.STRING),
        new ColumnSchema("target_port_list", DataType.STRING),
        new ColumnSchema("target_status_code_list", DataType.STRING),
        new ColumnSchema("classification", DataType.STRING),
        new ColumnSchema("classification_reason", DataType.STRING)
    ), 25, true);

    public static final LogSchema SQUID = new LogSchema("squid", List.of(
        new ColumnSchema("timestamp", DataType.DATE_TIME, FieldDecoders.EPOCH_SECONDS),
        new ColumnSchema("elapsed", DataType.INT),
        new ColumnSchema("remote_host", DataType.HOST),
        new ColumnSchema("code_and_status", DataType.STRING),
        new ColumnSchema("bytes", DataType.INT),
        new ColumnSchema("method", DataType.STRING),
        new ColumnSchema("url", DataType.STRING),
        new ColumnSchema("rfc931", DataType.STRING),
        new ColumnSchema("peerstatus_and_peerhost", DataType.STRING),
        new ColumnSchema("type", DataType.STRING)
    ), 10, false);

    public static final LogSchema S3 = new LogSchema("s3", List.of(
        new ColumnSchema("bucket_owner", DataType.STRING),
        new ColumnSchema("bucket", DataType.STRING),
        new ColumnSchema("time", DataType.DATE_TIME, FieldDecoders.CLF_TIMESTAMP),
        new ColumnSchema("remote_ip", DataType.HOST),
        new ColumnSchema("requester", DataType.STRING),
        new ColumnSchema("request_id", DataType.STRING),
        new ColumnSchema("operation", DataType.STRING),
        new ColumnSchema("key", DataType.STRING),
        new ColumnSchema("request_uri", DataType.HTTP_REQUEST),
        new ColumnSchema("http_status", DataType.INT),
        new ColumnSchema("error_code", DataType.STRING),
        new ColumnSchema("bytes_sent", DataType.INT),
        new ColumnSchema("object_size", DataType.INT),
        new ColumnSchema("total_time", DataType.INT),
        new ColumnSchema("turn_around_time", DataType.INT),
        new ColumnSchema("referrer", DataType.STRING),
        new ColumnSchema("user_agent", DataType.STRING),
        new ColumnSchema("version_id", DataType.STRING),
        new ColumnSchema("host_id", DataType.STRING),
        new ColumnSchema("signature_version", DataType.STRING),
        new ColumnSchema("cipher_suite", DataType.STRING),
        new ColumnSchema("authentication_type", DataType.STRING),
        new ColumnSchema("host_header", DataType.STRING),
        new ColumnSchema("tls_version", DataType.STRING)
    ), 18, true);

    private static final Map<String, LogSchema> SCHEMAS;
    static {
        Map<String, LogSchema> m = new LinkedHashMap<>();
        for (LogSchema s : List.of(ELB, ALB, SQUID, S3)) m.put(s.name(), s);
        SCHEMAS = Map.copyOf(m);
    }

    // Map.copyOf does not keep order; error messages list formats in declaration order.
    private static final List<String> NAMES = List.of(ELB.name(), ALB.name(), SQUID.name(), S3.name());

    /** Case-sensitive lookup of a format name. */
    public static Optional<LogSchema> lookup(String formatName) {
        return Optional.ofNullable(formatName == null ? null : SCHEMAS.get(formatName));
    }

    public static boolean isSupported(String formatName) {
        return formatName != null && SCHEMAS.containsKey(formatName);
    }

    public static List<String> formatNames() { return NAMES; }
}
