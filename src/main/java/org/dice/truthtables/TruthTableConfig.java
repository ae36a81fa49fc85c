package org.dice.truthtables;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for table generation. Values come from the defaults below, then the classpath resource
 * {@value #RESOURCE_NAME}, then JVM system properties prefixed with {@value #SYSTEM_PROPERTY_PREFIX}.
 * Invalid values are logged and ignored.
 */
public class TruthTableConfig {

    private static final Logger log = LoggerFactory.getLogger( TruthTableConfig.class );

    public static final String RESOURCE_NAME = "truthtables.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "truthtables.";

    // rows double with every variable; the whole table is held in memory, 2^24 rows at the ceiling
    private int maxVariables = DEFAULT_MAX_VARIABLES;
    public static final String MAX_VARIABLES = "maxVariables";
    public static final int DEFAULT_MAX_VARIABLES = 20;
    public static final int MAX_VARIABLES_CEILING = 24;

    private boolean strictLexer = true;
    public static final String STRICT_LEXER = "lexer.strict";

    private boolean showSubExpressions = true;
    public static final String SHOW_SUB_EXPRESSIONS = "showSubExpressions";

    public static TruthTableConfig load() {
        TruthTableConfig config = new TruthTableConfig();
        config.init(loadResource(RESOURCE_NAME));
        config.init(withPrefix(System.getProperties(), SYSTEM_PROPERTY_PREFIX));
        return config;
    }

    public void init(Properties initArgs) {
        String sMaxVariables = initArgs.getProperty(MAX_VARIABLES);
        if (false == StringUtils.isBlank(sMaxVariables)) {
            try {
                setMaxVariables(Integer.parseInt(sMaxVariables.trim()));
            } catch (NumberFormatException ex) {
                log.error(String.format("Invalid value for %s: %s. Keeping %d", MAX_VARIABLES, sMaxVariables, maxVariables));
            } catch (IllegalArgumentException ex) {
                log.error(ex.getMessage());
            }
        }

        Boolean strict = parseBoolean(initArgs, STRICT_LEXER);
        if (strict != null) {
            this.strictLexer = strict;
        }

        Boolean showSubs = parseBoolean(initArgs, SHOW_SUB_EXPRESSIONS);
        if (showSubs != null) {
            this.showSubExpressions = showSubs;
        }
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    public void setMaxVariables(int maxVariables) {
        if (maxVariables < 1 || maxVariables > MAX_VARIABLES_CEILING) {
            throw new IllegalArgumentException(String.format("%s must be between 1 and %d but was %d",
                    MAX_VARIABLES, MAX_VARIABLES_CEILING, maxVariables));
        }
        this.maxVariables = maxVariables;
    }

    public boolean isStrictLexer() {
        return strictLexer;
    }

    public void setStrictLexer(boolean strictLexer) {
        this.strictLexer = strictLexer;
    }

    public boolean isShowSubExpressions() {
        return showSubExpressions;
    }

    public void setShowSubExpressions(boolean showSubExpressions) {
        this.showSubExpressions = showSubExpressions;
    }

    @Override
    public String toString(){
        return String.format("%s=%d, %s=%s, %s=%s", MAX_VARIABLES, maxVariables,
                STRICT_LEXER, strictLexer, SHOW_SUB_EXPRESSIONS, showSubExpressions);
    }

    private static Boolean parseBoolean(Properties initArgs, String name) {
        String value = initArgs.getProperty(name);
        if (StringUtils.isBlank(value)) {
            return null;
        }
        value = value.trim();
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        log.error(String.format("Invalid boolean value for %s: %s. Ignoring", name, value));
        return null;
    }

    static Properties loadResource(String resourceName) {
        Properties properties = new Properties();
        InputStream stream = TruthTableConfig.class.getClassLoader().getResourceAsStream(resourceName);
        if (stream == null) {
            log.debug(String.format("No %s on the classpath, using defaults", resourceName));
            return properties;
        }
        try {
            properties.load(stream);
        } catch (IOException e) {
            log.warn(String.format("Failed to read %s, using defaults", resourceName), e);
        } finally {
            try {
                stream.close();
            } catch (IOException e) {
                log.warn(String.format("Failed to close %s", resourceName), e);
            }
        }
        return properties;
    }

    static Properties withPrefix(Properties source, String prefix) {
        Properties properties = new Properties();
        for (String name : source.stringPropertyNames()) {
            if (name.startsWith(prefix)) {
                properties.setProperty(name.substring(prefix.length()), source.getProperty(name));
            }
        }
        return properties;
    }
}
