package org.gta3sc.compiler.entities;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.gta3sc.compiler.api.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads model tables from HOCON files of the form:
 * <pre>
 * models {
 *   PLAYER_CAR = 90
 *   "cellphone" = 258
 * }
 * </pre>
 */
public class HoconModelTableLoader implements ModelTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(HoconModelTableLoader.class);

    private static final String ROOT_KEY = "models";

    @Override
    public ModelTable loadDefaultTable(Path path) {
        return load(path);
    }

    @Override
    public ModelTable loadLevelTable(Path path) {
        return load(path);
    }

    private ModelTable load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Model table not found: " + path);
        }
        try {
            Config file = ConfigFactory.parseFile(path.toFile()).resolve();
            if (!file.hasPath(ROOT_KEY)) {
                throw new ConfigurationException("Model table " + path + " has no '" + ROOT_KEY + "' section");
            }
            ModelTable.Builder builder = ModelTable.builder();
            for (Map.Entry<String, ConfigValue> entry : file.getObject(ROOT_KEY).entrySet()) {
                ConfigValue value = entry.getValue();
                if (value.valueType() != ConfigValueType.NUMBER) {
                    throw new ConfigurationException("Model '" + entry.getKey() + "' in " + path
                            + " must have a numeric id, got " + value.valueType());
                }
                double id = ((Number) value.unwrapped()).doubleValue();
                if (id != Math.rint(id)) {
                    throw new ConfigurationException("Model '" + entry.getKey() + "' in " + path
                            + " must have an integral id, got " + value.render());
                }
                // getInt rejects ids outside the int range
                builder.put(entry.getKey(), file.getInt(ConfigUtil.joinPath(ROOT_KEY, entry.getKey())));
            }
            ModelTable table = builder.build();
            LOG.debug("Loaded {} models from {}", table.size(), path);
            return table;
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to read model table " + path + ": " + e.getMessage(), e);
        }
    }
}
