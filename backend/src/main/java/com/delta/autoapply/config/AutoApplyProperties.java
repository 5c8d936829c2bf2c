package com.delta.autoapply.config;

import com.delta.autoapply.run.model.ApplicantAnswers;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "autoapply")
public class AutoApplyProperties {
    private static final String DEFAULT_USER_AGENT = "auto-apply/0.1 (+contact)";

    private String filesDir = "./files";
    private Auth auth = new Auth();
    private Browser browser = new Browser();
    private Tailoring tailoring = new Tailoring();
    private Scrape scrape = new Scrape();
    private Runs runs = new Runs();
    private Applicant applicant = new Applicant();

    public String getFilesDir() {
        return filesDir == null || filesDir.isBlank() ? "./files" : filesDir;
    }

    public void setFilesDir(String filesDir) {
        this.filesDir = filesDir;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Tailoring getTailoring() {
        return tailoring;
    }

    public void setTailoring(Tailoring tailoring) {
        this.tailoring = tailoring;
    }

    public Scrape getScrape() {
        return scrape;
    }

    public void setScrape(Scrape scrape) {
        this.scrape = scrape;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
    }

    public Applicant getApplicant() {
        return applicant;
    }

    public void setApplicant(Applicant applicant) {
        this.applicant = applicant;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Auth {
        private String stateDir = "./auth";
        private int pollIntervalMs = 1000;
        private int maxPollAttempts = 600;
        private int guestSettleMs = 600;

        public String getStateDir() {
            return stateDir == null || stateDir.isBlank() ? "./auth" : stateDir;
        }

        public void setStateDir(String stateDir) {
            this.stateDir = stateDir;
        }

        public int getPollIntervalMs() {
            return Math.max(0, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(0, pollIntervalMs);
        }

        public int getMaxPollAttempts() {
            return Math.max(1, maxPollAttempts);
        }

        public void setMaxPollAttempts(int maxPollAttempts) {
            this.maxPollAttempts = Math.max(1, maxPollAttempts);
        }

        public int getGuestSettleMs() {
            return Math.max(0, guestSettleMs);
        }

        public void setGuestSettleMs(int guestSettleMs) {
            this.guestSettleMs = Math.max(0, guestSettleMs);
        }
    }

    public static class Browser {
        private boolean headless = false;
        private int viewportWidth = 1280;
        private int viewportHeight = 860;
        private int navigationTimeoutMs = 30000;
        private int actionTimeoutMs = 5000;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getViewportWidth() {
            return Math.max(320, viewportWidth);
        }

        public void setViewportWidth(int viewportWidth) {
            this.viewportWidth = viewportWidth;
        }

        public int getViewportHeight() {
            return Math.max(240, viewportHeight);
        }

        public void setViewportHeight(int viewportHeight) {
            this.viewportHeight = viewportHeight;
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1000, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = navigationTimeoutMs;
        }

        public int getActionTimeoutMs() {
            return Math.max(100, actionTimeoutMs);
        }

        public void setActionTimeoutMs(int actionTimeoutMs) {
            this.actionTimeoutMs = actionTimeoutMs;
        }
    }

    public static class Tailoring {
        private String provider = "noop";
        private String baseUrl = "http://localhost:11434/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private int timeoutSeconds = 60;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Scrape {
        private String userAgent;
        private int timeoutMs = 30000;
        private int maxChars = 120000;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getTimeoutMs() {
            return Math.max(1, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = Math.max(1, timeoutMs);
        }

        public int getMaxChars() {
            return Math.max(1, maxChars);
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = Math.max(1, maxChars);
        }
    }

    public static class Runs {
        private int retentionSeconds = 600;

        public int getRetentionSeconds() {
            return Math.max(0, retentionSeconds);
        }

        public void setRetentionSeconds(int retentionSeconds) {
            this.retentionSeconds = Math.max(0, retentionSeconds);
        }
    }

    public static class Applicant {
        private String fullName = "";
        private String email = "";
        private String phone = "";
        private String city = "";
        private String state = "";
        private String linkedin;
        private String website;
        private String github;
        private boolean usCitizen = true;
        private boolean needsSponsorship = false;
        private boolean protectedVeteran = false;
        private boolean hasDisability = false;

        public ApplicantAnswers toAnswers() {
            return ApplicantAnswers.of(
                fullName,
                email,
                phone,
                city,
                state,
                linkedin,
                website,
                github,
                usCitizen,
                needsSponsorship,
                protectedVeteran,
                hasDisability
            );
        }

        public String getFullName() {
            return fullName;
        }

        public void setFullName(String fullName) {
            this.fullName = fullName;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getPhone() {
            return phone;
        }

        public void setPhone(String phone) {
            this.phone = phone;
        }

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = city;
        }

        public String getState() {
            return state;
        }

        public void setState(String state) {
            this.state = state;
        }

        public String getLinkedin() {
            return linkedin;
        }

        public void setLinkedin(String linkedin) {
            this.linkedin = linkedin;
        }

        public String getWebsite() {
            return website;
        }

        public void setWebsite(String website) {
            this.website = website;
        }

        public String getGithub() {
            return github;
        }

        public void setGithub(String github) {
            this.github = github;
        }

        public boolean isUsCitizen() {
            return usCitizen;
        }

        public void setUsCitizen(boolean usCitizen) {
            this.usCitizen = usCitizen;
        }

        public boolean isNeedsSponsorship() {
            return needsSponsorship;
        }

        public void setNeedsSponsorship(boolean needsSponsorship) {
            this.needsSponsorship = needsSponsorship;
        }

        public boolean isProtectedVeteran() {
            return protectedVeteran;
        }

        public void setProtectedVeteran(boolean protectedVeteran) {
            this.protectedVeteran = protectedVeteran;
        }

        public boolean isHasDisability() {
            return hasDisability;
        }

        public void setHasDisability(boolean hasDisability) {
            this.hasDisability = hasDisability;
        }
    }
}
