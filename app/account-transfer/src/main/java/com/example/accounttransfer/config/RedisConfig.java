/*
 * どこで: Account Transfer インフラ設定
 * 何を: 操作ログの保存で利用する StringRedisTemplate を提供する
 * なぜ: 直近の実行ログを TTL 付きで保持する Repository が Redis へアクセスできるようにするため
 */
package com.example.accounttransfer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
