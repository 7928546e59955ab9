package com.example.kodeposimport.config;

import com.univocity.parsers.csv.CsvFormat;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app") // 对应 application.yml 中的 app:
public class AppProperties {

    // 1. 导入作业相关 (app.importing)
    private Import importing = new Import();

    // 2. CSV 解析 (app.csv)
    private CsvDetailConfig csv = new CsvDetailConfig();

    // 3. 业务区域 (app.region)
    private Region region = new Region();

    private Store store = new Store();

    private Maintenance maintenance = new Maintenance();

    // 当前节点标识，写入作业的 node_id；多实例部署时每个节点必须不同
    private String currentNodeId = "local";

    @Data
    public static class Import {
        // 上传文件上限 (字节)，默认 10MB
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private int maxBatchSize = 10_000;
        private int defaultBatchSize = 1000;
        private int historyDefaultPageSize = 20;
        private int historyMaxPageSize = 100;
        // dry-run 预估: 每秒处理多少条
        private int estimateRecordsPerSecond = 100;
    }

    /**
     * CSV 细节配置
     * 包含 delimiter 等以及生成 Settings 的工厂方法
     */
    @Data
    public static class CsvDetailConfig {

        private char delimiter = ',';

        private char quote = '"';

        // '\0' 表示不识别注释行, 以 # 开头的数据行照常解析
        private char comment = '\0';

        /**
         * 换行符配置
         * 可选值: "\n", "\r\n", 或者 "AUTO" (自动检测)
         */
        private String lineSeparator = "AUTO";

        // 第一行是表头 (字段名)
        private boolean headerExtraction = true;

        // 单个单元格最大字符数
        private int maxCharsPerColumn = 4096;

        private boolean ignoreLeadingWhitespaces = true;

        private boolean ignoreTrailingWhitespaces = true;

        // 读取时将什么字符串视为 null
        private String nullValue = null;

        /**
         * 工厂方法：生成读取配置
         */
        public CsvParserSettings toParserSettings() {
            CsvParserSettings settings = new CsvParserSettings();

            CsvFormat format = settings.getFormat();
            format.setDelimiter(this.delimiter);
            format.setQuote(this.quote);
            format.setComment(this.comment);
            if ("AUTO".equalsIgnoreCase(this.lineSeparator) || this.lineSeparator == null) {
                settings.setLineSeparatorDetectionEnabled(true);
            } else {
                format.setLineSeparator(this.lineSeparator);
            }
            settings.setHeaderExtractionEnabled(this.headerExtraction);
            settings.setMaxCharsPerColumn(this.maxCharsPerColumn);
            settings.setIgnoreLeadingWhitespaces(this.ignoreLeadingWhitespaces);
            settings.setIgnoreTrailingWhitespaces(this.ignoreTrailingWhitespaces);
            if (this.nullValue != null) {
                settings.setNullValue(this.nullValue);
            }
            settings.setSkipEmptyLines(true);
            settings.setReadInputOnSeparateThread(false);

            return settings;
        }
    }

    /**
     * 印尼邮编的业务范围
     */
    @Data
    public static class Region {
        private int minCode = 10000;
        private int maxCode = 99999;
        private double minLatitude = -11.0;
        private double maxLatitude = 6.0;
        private double minLongitude = 95.0;
        private double maxLongitude = 141.0;
        private int provinceMaxLength = 50;
        private int textMaxLength = 100;
    }

    @Data
    public static class Store {
        // JDBC 语句超时 (秒)，0 表示不限制
        private int queryTimeoutSeconds = 30;
    }

    @Data
    public static class Maintenance {
        private boolean enabled = true;
        // 超过多少分钟没有进度更新视为僵尸作业
        private int stalledMinutes = 30;
        // 校验结果和统计行保留天数，0 表示不清理
        private int retentionDays = 90;
        private long stalledCheckIntervalMs = 600_000;
        private String purgeCron = "0 0 3 * * *";
    }

}
