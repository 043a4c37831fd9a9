package io.beaconmesh.config;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.beaconmesh.exception.MeshException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.io.IOException;
import java.nio.file.Path;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static io.beaconmesh.constant.MeshConstant.DEFAULT_CONFIG_RESOURCE;
import static io.beaconmesh.exception.MeshExceptionType.INVALID_CONFIG;
import static java.util.Objects.isNull;

@ToString
@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ConfigObj {

    private static final YAMLMapper mapper = YAMLMapper.builder()
            .configure(FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    public static ConfigObj initConfig(Path configPath) throws IOException {
        return mapper.readValue(configPath.toFile(), ConfigObj.class);
    }

    public static ConfigObj defaultConfig() {
        try (var configIS = ConfigObj.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (isNull(configIS)) {
                throw new MeshException(INVALID_CONFIG, "Missing classpath resource " + DEFAULT_CONFIG_RESOURCE);
            }

            return mapper.readValue(configIS, ConfigObj.class);
        } catch (IOException e) {
            throw new MeshException(INVALID_CONFIG, "Could not parse " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    private MeshConf mesh;

    public MeshConf getMesh() {
        if (isNull(mesh)) {
            mesh = new MeshConf();
        }

        return mesh;
    }
}
