package com.phillippitts.sendspin.service.discovery;

import com.phillippitts.sendspin.config.properties.SendspinProperties;
import com.phillippitts.sendspin.service.protocol.SendspinProtocol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.jmdns.JmDNS;
import javax.jmdns.ServiceInfo;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Map;

/**
 * {@link ServiceAdvertiser} backed by JmDNS, announcing {@code _sendspin._tcp.local.} with a
 * {@code path} TXT record.
 */
@Component
public class JmDnsServiceAdvertiser implements ServiceAdvertiser {

    private static final Logger LOG = LogManager.getLogger(JmDnsServiceAdvertiser.class);

    static final String SERVICE_TYPE = SendspinProtocol.SERVICE_TYPE + "local.";

    private final String bindAddress;

    private final Object lock = new Object();
    private JmDNS jmdns;
    private ServiceInfo registered;

    public JmDnsServiceAdvertiser(SendspinProperties props) {
        this.bindAddress = props.getMdnsAddress();
    }

    static ServiceInfo serviceInfo(String instanceName, int port, String path) {
        return ServiceInfo.create(SERVICE_TYPE, instanceName, port, 0, 0,
                Map.of(SendspinProtocol.TXT_PATH_KEY, path));
    }

    @Override
    public void register(String instanceName, int port, String path) throws IOException {
        synchronized (lock) {
            if (jmdns == null) {
                jmdns = bindAddress == null
                        ? JmDNS.create()
                        : JmDNS.create(InetAddress.getByName(bindAddress));
            }
            if (registered != null) {
                jmdns.unregisterService(registered);
                registered = null;
            }
            ServiceInfo info = serviceInfo(instanceName, port, path);
            jmdns.registerService(info);
            registered = info;
            LOG.info("mDNS service registered: name='{}' type={} port={} path={} on {}",
                    instanceName, SERVICE_TYPE, port, path, jmdns.getInetAddress());
        }
    }

    @Override
    public void unregister() {
        synchronized (lock) {
            if (jmdns == null) {
                return;
            }
            try {
                jmdns.unregisterAllServices();
                jmdns.close();
                LOG.info("mDNS service unregistered");
            } catch (IOException e) {
                LOG.warn("Error closing mDNS responder: {}", e.toString());
            } finally {
                jmdns = null;
                registered = null;
            }
        }
    }

    @Override
    public boolean isRegistered() {
        synchronized (lock) {
            return registered != null;
        }
    }
}
