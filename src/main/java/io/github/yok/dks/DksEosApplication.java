package io.github.yok.dks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * dks-eos のエントリポイントです。
 *
 * <p>
 * 設定クラス（@ConfigurationProperties）をスキャンし、CLI 実行を開始します。
 * </p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.github.yok.dks")
public class DksEosApplication {

    /**
     * Spring Boot アプリケーションを起動します。
     *
     * @param args 起動引数です
     */
    public static void main(String[] args) {
        SpringApplication.run(DksEosApplication.class, args);
    }
}
