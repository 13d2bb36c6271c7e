package com.vcc.traingateway.model;

import com.vcc.traingateway.entity.AccountEntity;

/**
 * Router output: the account bound to this call and the model id rewritten for its provider.
 */
public record RoutedAccount(AccountEntity account, Provider provider, String upstreamModel) {
}
