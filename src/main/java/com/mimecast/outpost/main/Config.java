package com.mimecast.outpost.main;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigFoundation;
import com.mimecast.outpost.config.queue.QueueConfigLoader;
import com.mimecast.outpost.config.queue.StrategyCatalog;
import com.mimecast.outpost.expr.DefaultPolicyResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Master configuration initializer and container.
 *
 * <p>Holds the root queue configuration, the strategy catalog built from it
 * and the policy resolver expressions are evaluated with.
 * <p>Local domains are read from {@code directory.<name>.domains}.
 *
 * @see QueueConfigLoader
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Private constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Root queue configuration.
     */
    private static BasicConfig queue = new BasicConfig(Collections.emptyMap());

    /**
     * Strategy catalog.
     */
    private static StrategyCatalog catalog = StrategyCatalog.defaults();

    /**
     * Policy resolver.
     */
    private static DefaultPolicyResolver resolver = new DefaultPolicyResolver(queue);

    /**
     * Init queue config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static synchronized void initQueue(String path) throws IOException {
        BasicConfig root = new BasicConfig(ConfigFoundation.readFile(Paths.get(path)));
        StrategyCatalog loaded = QueueConfigLoader.load(root);

        DefaultPolicyResolver policy = new DefaultPolicyResolver(root);
        BasicConfig directories = root.getSection("directory");
        for (String name : directories.getKeys()) {
            List<String> domains = directories.getSection(name).getListProperty("domains").stream()
                    .map(String::valueOf)
                    .collect(Collectors.toList());
            policy.addLocalDomains(name, domains);
            log.debug("Directory {} local domains: {}", name, domains.size());
        }

        queue = root;
        catalog = loaded;
        resolver = policy;
        log.info("Loaded queue config: {}", path);
    }

    /**
     * Gets root queue config.
     *
     * @return BasicConfig.
     */
    public static BasicConfig getQueue() {
        return queue;
    }

    /**
     * Gets strategy catalog.
     *
     * @return StrategyCatalog.
     */
    public static StrategyCatalog getCatalog() {
        return catalog;
    }

    /**
     * Gets policy resolver.
     *
     * @return DefaultPolicyResolver.
     */
    public static DefaultPolicyResolver getResolver() {
        return resolver;
    }
}
