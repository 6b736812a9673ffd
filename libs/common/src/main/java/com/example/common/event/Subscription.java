/*
 * どこで: Common イベント購読
 * 何を: リスナー登録を解除するハンドル
 * なぜ: 登録元がリスナー参照を保持しなくても解除できるようにするため
 */
package com.example.common.event;

@FunctionalInterface
public interface Subscription {

  void unsubscribe();
}
