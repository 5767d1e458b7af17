package model;

/**
 * 资源键：resourceType + ":" + resourceId，锁表和操作日志共用
 */
public final class ResourceKey {

    private ResourceKey() {
    }

    public static String of(String resourceType, String resourceId) {
        return resourceType + ":" + resourceId;
    }
}
