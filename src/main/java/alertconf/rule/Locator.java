package alertconf.rule;

import java.util.Objects;

/**
 * 实体在规则文本中的位置. 由 {@link LocationType} 区分载荷类型
 */
public final class Locator {

    public enum LocationType {
        /**
         * 原生单文件规则文本中的行区间
         */
        NATIVE
    }

    /**
     * 行号从 1 开始, 闭区间
     */
    public record NativeLocation(int startLine, int endLine) {
    }

    private final LocationType type;
    private final NativeLocation nativeLocation;

    private Locator(LocationType type, NativeLocation nativeLocation) {
        this.type = type;
        this.nativeLocation = nativeLocation;
    }

    public static Locator nativeLines(int startLine, int endLine) {
        return new Locator(LocationType.NATIVE, new NativeLocation(startLine, Math.max(startLine, endLine)));
    }

    public LocationType getType() {
        return type;
    }

    public NativeLocation getNativeLocation() {
        if (type != LocationType.NATIVE) {
            throw new IllegalStateException("不是原生位置: " + type);
        }
        return nativeLocation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Locator)) {
            return false;
        }
        Locator other = (Locator) o;
        return type == other.type && Objects.equals(nativeLocation, other.nativeLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, nativeLocation);
    }

    @Override
    public String toString() {
        return type + nativeLocation.toString();
    }
}
