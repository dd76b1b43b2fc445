package com.tripsync.common.constant;

public class StorageConstants {

    private StorageConstants() {
    }

    /** 当前文档结构版本；新建与落盘的文档都必须是该版本 */
    public static final int CURRENT_SCHEMA_VERSION = 7;

    /** 行程文件前缀：trip-{tripId}.json */
    public static final String TRIP_FILE_PREFIX = "trip-";

    /** JSON 文件后缀 */
    public static final String JSON_SUFFIX = ".json";

    /** 临时文件后缀（原子替换用） */
    public static final String TEMP_SUFFIX = ".tmp";

    /** 删除备份文件前缀：deleted-{trip|cost}-{tripId}-{timestamp}.json */
    public static final String DELETED_BACKUP_PREFIX = "deleted-";

    /** 损坏文件隔离前缀：corrupted-trip-{tripId}-{timestamp}.json.corrupt */
    public static final String CORRUPTED_BACKUP_PREFIX = "corrupted-trip-";

    /** 损坏文件隔离后缀 */
    public static final String CORRUPTED_SUFFIX = ".json.corrupt";

    /** 备份文档里附加的元数据块字段名 */
    public static final String BACKUP_METADATA_FIELD = "backupMetadata";

    /** 占位 locationId：历史上先于所属地点创建的住宿会带上该值 */
    public static final String PLACEHOLDER_LOCATION_ID = "temp-location";

    /** 找不到所属地点时展示的名称 */
    public static final String UNKNOWN_LOCATION_NAME = "Unknown location";

    /** 行程 ID 允许的字符与长度 */
    public static final String TRIP_ID_PATTERN = "^[A-Za-z0-9_-]{1,200}$";

    /** 公开动态默认保留条数 */
    public static final int DEFAULT_PUBLIC_UPDATES_LIMIT = 100;

    /** MDC 中记录行程 ID 的 key */
    public static final String MDC_TRIP_ID = "tripId";
}
