package me.go_gradually.ivrphone.infrastructure.shared.config;

import me.go_gradually.ivrphone.application.call.policy.CallPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "ivrphone")
public class AppProperties implements CallPolicy {
    private Sip sip = new Sip();
    private Media media = new Media();
    private Sounds sounds = new Sounds();
    private List<Account> accounts = new ArrayList<>();

    public Sip getSip() {
        return sip;
    }

    public void setSip(Sip sip) {
        this.sip = sip;
    }

    public Media getMedia() {
        return media;
    }

    public void setMedia(Media media) {
        this.media = media;
    }

    public Sounds getSounds() {
        return sounds;
    }

    public void setSounds(Sounds sounds) {
        this.sounds = sounds;
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<Account> accounts) {
        this.accounts = accounts == null ? new ArrayList<>() : accounts;
    }

    @Override
    public long answerTimeoutMs() {
        return sip.getAnswerTimeoutMs();
    }

    public static class Sip {
        private boolean enabled = true;
        private String listenAddress = "lv4";
        private int port = 5060;
        private String transport = "udp";
        private String stackName = "ivrphone";
        private long ringingDelayMs = 500;
        private long ackTimeoutMs = 32_000;
        private long answerTimeoutMs = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getListenAddress() {
            return listenAddress;
        }

        public void setListenAddress(String listenAddress) {
            this.listenAddress = listenAddress;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getTransport() {
            return transport;
        }

        public void setTransport(String transport) {
            this.transport = transport;
        }

        public String getStackName() {
            return stackName;
        }

        public void setStackName(String stackName) {
            this.stackName = stackName;
        }

        public long getRingingDelayMs() {
            return ringingDelayMs;
        }

        public void setRingingDelayMs(long ringingDelayMs) {
            this.ringingDelayMs = ringingDelayMs;
        }

        public long getAckTimeoutMs() {
            return ackTimeoutMs;
        }

        public void setAckTimeoutMs(long ackTimeoutMs) {
            this.ackTimeoutMs = ackTimeoutMs;
        }

        public long getAnswerTimeoutMs() {
            return answerTimeoutMs;
        }

        public void setAnswerTimeoutMs(long answerTimeoutMs) {
            this.answerTimeoutMs = answerTimeoutMs;
        }
    }

    public static class Media {
        private int rtpPort = 49170;

        public int getRtpPort() {
            return rtpPort;
        }

        public void setRtpPort(int rtpPort) {
            this.rtpPort = rtpPort;
        }
    }

    public static class Sounds {
        private String baseDir = "sounds";

        public String getBaseDir() {
            return baseDir;
        }

        public void setBaseDir(String baseDir) {
            this.baseDir = baseDir;
        }
    }

    public static class Account {
        private String username;
        private String password;
        private String domain;
        private int expiry = 120;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain;
        }

        public int getExpiry() {
            return expiry;
        }

        public void setExpiry(int expiry) {
            this.expiry = expiry;
        }

        public String addressOfRecord() {
            return "sip:" + username + "@" + domain;
        }
    }
}
