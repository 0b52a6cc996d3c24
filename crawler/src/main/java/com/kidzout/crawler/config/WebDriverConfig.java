package com.kidzout.crawler.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

/**
 * Chrome driver for the browser-backed fetcher. Only active with {@code crawler.fetch.type=browser}.
 */
@Configuration
@ConditionalOnProperty(name = "crawler.fetch.type", havingValue = "browser")
@RequiredArgsConstructor
@Slf4j
public class WebDriverConfig {

    private final CrawlerConfig crawlerConfig;

    /**
     * A new driver per request of the bean; the fetcher keeps one per domain.
     */
    @Bean
    @Scope("prototype")
    public WebDriver webDriver() {
        CrawlerConfig.Fetch settings = crawlerConfig.getFetch();
        log.info("🌐 Starting Chrome for browser fetches (headless={})", settings.isHeadlessBrowser());

        WebDriver driver = new ChromeDriver(chromeOptions(settings));
        driver.manage().timeouts().pageLoadTimeout(settings.getTimeout());
        return driver;
    }

    static ChromeOptions chromeOptions(CrawlerConfig.Fetch settings) {
        ChromeOptions options = new ChromeOptions();
        if (settings.isHeadlessBrowser()) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox", "--disable-dev-shm-usage", "--lang=de-DE");
        if (!settings.getUserAgents().isEmpty()) {
            options.addArguments("--user-agent=" + settings.getUserAgents().get(0));
        }
        return options;
    }
}
