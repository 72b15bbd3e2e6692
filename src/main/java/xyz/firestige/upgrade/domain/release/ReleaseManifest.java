package xyz.firestige.upgrade.domain.release;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 发布清单值对象：一个版本号及其每个服务对应的镜像引用
 */
public record ReleaseManifest(String version, Map<String, String> images) {

    public ReleaseManifest {
        Objects.requireNonNull(version, "version cannot be null");
        images = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(images, "images cannot be null")));
    }

    public String imageOf(String service) {
        String image = images.get(service);
        if (image == null) {
            throw new IllegalArgumentException(String.format("版本 %s 未包含服务 %s 的镜像", version, service));
        }
        return image;
    }

    public boolean covers(String service) {
        return images.containsKey(service);
    }

    public List<String> imageRefs() {
        return new ArrayList<>(new LinkedHashSet<>(images.values()));
    }
}
